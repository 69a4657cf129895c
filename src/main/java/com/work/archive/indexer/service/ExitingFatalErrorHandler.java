package com.work.archive.indexer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 记录错误后关闭 Spring 上下文并以非零码退出进程。
 *
 * 关闭在独立线程执行：调用方通常是 worker 线程，而上下文关闭会等待这些线程池停止。
 */
public class ExitingFatalErrorHandler implements FatalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ExitingFatalErrorHandler.class);

    public static final int EXIT_CODE = 2;

    private final ConfigurableApplicationContext context;
    private final AtomicBoolean triggered = new AtomicBoolean(false);

    public ExitingFatalErrorHandler(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @Override
    public void onFatal(String reason, Throwable cause) {
        log.error("fatal error, stopping archive ingestion. reason={}", reason, cause);
        if (!triggered.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(() -> {
            int code = SpringApplication.exit(context, () -> EXIT_CODE);
            System.exit(code);
        }, "archive-fatal-exit");
        t.setDaemon(false);
        t.start();
    }
}
