package com.samsung.ees.infra.api.remotedb.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@ConfigurationProperties("remote-query")
@Component
@Data
@Validated
public class RemoteQueryProperties {
    static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*";

    /**
     * Interpreter used to run the query helper on the remote host.
     */
    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_./-]+")
    String pythonCommand = "python3";

    /**
     * Tried once when the primary interpreter is not installed.
     */
    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9_./-]+")
    String fallbackPythonCommand = "python";

    /**
     * Remote directory that receives result files. Embedded in shell text, so only plain path characters.
     */
    @NotBlank
    @Pattern(regexp = "/[A-Za-z0-9_./-]*")
    String remoteScratchDir = "/tmp";

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration commandTimeout = Duration.ofMinutes(5);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    Duration transferTimeout = Duration.ofMinutes(5);

    /**
     * Number of rows between two progress notifications while merging a wide table.
     */
    @Min(1)
    int progressStride = 100;

    /**
     * Fetch device rows and command rows concurrently. Only safe when the shell channel
     * tolerates concurrent commands.
     */
    boolean parallelFetch = false;

    /**
     * Location of the TOML payload extraction config, as a Spring resource location.
     */
    @NotBlank
    String extractionConfig = "classpath:extraction-config.toml";

    @Valid
    @NotNull
    Tables tables = new Tables();

    @Valid
    @NotNull
    Ssh ssh = new Ssh();

    @Data
    public static class Tables {
        @Pattern(regexp = IDENTIFIER)
        String device = "device_data";

        @Pattern(regexp = IDENTIFIER)
        String deviceExt = "device_data_ext";

        @Pattern(regexp = IDENTIFIER)
        String command = "cmd_data";
    }

    @Data
    public static class Ssh {
        String host = "localhost";

        @Min(1)
        int port = 22;

        String user;

        /**
         * Private key handed to ssh/scp with {@code -i}. Agent or default keys are used when unset.
         */
        String identityFile;

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        Duration connectTimeout = Duration.ofSeconds(10);

        @NotBlank
        String sshExecutable = "ssh";

        @NotBlank
        String scpExecutable = "scp";
    }
}
