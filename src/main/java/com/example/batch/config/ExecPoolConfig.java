package com.example.batch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 线程池
 * - taskExec：进程内 Runner（IO 型任务友好），有限队列 + CallerRunsPolicy 形成背压
 * - taskScheduler：延迟下发与 @Scheduled 周期补扫
 */
@Configuration
public class ExecPoolConfig {

    @Bean("taskExec")
    public ThreadPoolTaskExecutor taskExec(@Value("${scheduler.runner.core-size:0}") int coreSize,
                                           @Value("${scheduler.runner.max-size:0}") int maxSize) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();

        // 0 表示按核数计算
        int cores = Runtime.getRuntime().availableProcessors();
        int corePoolSize = coreSize > 0 ? coreSize : Math.max(16, cores * 8);
        int maxPoolSize = Math.max(corePoolSize, maxSize > 0 ? maxSize : Math.max(32, cores * 16));

        e.setCorePoolSize(corePoolSize);
        e.setMaxPoolSize(maxPoolSize);
        e.setQueueCapacity(0);                    // 不排队，满了由提交线程自己执行
        e.setKeepAliveSeconds(30);
        e.setAllowCoreThreadTimeOut(true);
        e.setThreadNamePrefix("runner-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        // 优雅关闭
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(20);

        e.initialize();
        return e;
    }

    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(@Value("${scheduler.timer.pool-size:2}") int poolSize) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(Math.max(1, poolSize));
        s.setThreadNamePrefix("dispatch-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        return s;
    }
}
