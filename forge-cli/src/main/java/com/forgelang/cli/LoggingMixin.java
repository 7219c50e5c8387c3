package com.forgelang.cli;

import picocli.CommandLine.Option;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * {@code --verbose}：将展开流水线的 FINE 日志输出到 stderr
 */
public class LoggingMixin {

    static final String ROOT_LOGGER = "com.forgelang";

    @Option(names = {"-v", "--verbose"}, description = "输出各阶段的详细日志到 stderr")
    boolean verbose;

    void apply() {
        if (!verbose) {
            return;
        }
        Logger logger = Logger.getLogger(ROOT_LOGGER);
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.FINE);
        logger.addHandler(stderrHandler);
        logger.setLevel(Level.FINE);
        logger.setUseParentHandlers(false);
    }
}
