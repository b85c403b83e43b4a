package com.samsung.ees.infra.api.remotedb.config;

import com.samsung.ees.infra.api.remotedb.ssh.OpenSshShellChannel;
import com.samsung.ees.infra.api.remotedb.ssh.RemoteShellChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class RemoteExecutionConfig {

    @Bean
    @ConditionalOnMissingBean(RemoteShellChannel.class)
    public RemoteShellChannel remoteShellChannel(RemoteQueryProperties properties) {
        RemoteQueryProperties.Ssh ssh = properties.getSsh();
        log.info("Using OpenSSH channel to {}:{}", ssh.getHost(), ssh.getPort());
        return new OpenSshShellChannel(ssh, properties.getCommandTimeout());
    }

    /**
     * Runs result file downloads so their timeout is enforced apart from the remote command's.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService remoteTransferExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "remote-transfer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(2, threadFactory);
    }
}
