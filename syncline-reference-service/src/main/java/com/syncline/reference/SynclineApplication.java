package com.syncline.reference;

import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@EnableScheduling
@EnableTransactionManagement
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.syncline"})
public class SynclineApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} ({} bytes)", formatBytes(maxMemory), maxMemory);
        SpringApplication.run(SynclineApplication.class, args);
    }

    static String formatBytes(long bytes) {
        if (bytes >= 1_073_741_824L) return String.format(Locale.ROOT, "%.2f GB", bytes / 1_073_741_824.0);
        if (bytes >= 1_048_576L) return String.format(Locale.ROOT, "%.2f MB", bytes / 1_048_576.0);
        return String.format("%d bytes", bytes);
    }
}
