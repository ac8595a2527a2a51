package org.filesearcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FileSearcherApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(FileSearcherApplication.class, args);
    }

    /**
     * 提前创建日志目录（避免 logback 的 RollingFileAppender 因目录不存在而初始化失败）。
     * <p>
     * 规则与 logback-spring.xml 保持一致：优先读取系统属性/环境变量 LOG_PATH，默认使用 ./logs
     */
    static Path ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        Path dir = Path.of(logPath);
        try {
            Files.createDirectories(dir);
        } catch (Exception e) {
            // logback 尚未初始化，只能输出到 stderr（stdout 是 MCP stdio 通道）
            System.err.println("无法创建日志目录：" + dir + "（" + e.getMessage() + "）");
        }
        return dir;
    }
}
