package com.project.pvb.crypto;

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Centralized logging for registry and ledger operations.
 * Writes to the console and, when {@code PVB_ERROR_LOG} names a file, appends there as well.
 */
public class ErrorLogger {
    private static final String LOG_FILE_ENV = "PVB_ERROR_LOG";
    private static final ReentrantLock lock = new ReentrantLock();
    private static PrintWriter logWriter;

    static {
        String logFile = System.getenv(LOG_FILE_ENV);
        if (logFile != null && !logFile.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(logFile, true));
            } catch (IOException e) {
                System.err.println("Failed to initialize error logger at " + logFile + ": " + e.getMessage());
            }
        }
    }

    private ErrorLogger() {
    }

    public static void logError(String operation, String message, Throwable error) {
        lock.lock();
        try {
            String logEntry = String.format("[%s] ERROR in %s: %s", Instant.now(), operation, message);

            System.err.println(logEntry);
            if (error != null) {
                System.err.println("  Exception: " + error.getClass().getName());
                System.err.println("  Message: " + error.getMessage());
            }

            if (logWriter != null) {
                logWriter.println(logEntry);
                if (error != null) {
                    logWriter.println("  Exception: " + error.getClass().getName());
                    logWriter.println("  Message: " + error.getMessage());
                    error.printStackTrace(logWriter);
                }
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    public static void logWarning(String operation, String message) {
        write("WARN", operation, message, true);
    }

    public static void logInfo(String operation, String message) {
        write("INFO", operation, message, false);
    }

    private static void write(String level, String operation, String message, boolean toStderr) {
        lock.lock();
        try {
            String logEntry = String.format("[%s] %s in %s: %s", Instant.now(), level, operation, message);
            if (toStderr) {
                System.err.println(logEntry);
            } else {
                System.out.println(logEntry);
            }
            if (logWriter != null) {
                logWriter.println(logEntry);
                logWriter.flush();
            }
        } finally {
            lock.unlock();
        }
    }

    public static void close() {
        lock.lock();
        try {
            if (logWriter != null) {
                logWriter.close();
                logWriter = null;
            }
        } finally {
            lock.unlock();
        }
    }
}
