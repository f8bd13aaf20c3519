package net.gpumeter.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** 컨트롤러 + 프로세스 내 워커 */
@SpringBootApplication
@EnableScheduling
public class GpuMeterApplication {
    public static void main(String[] args) {
        SpringApplication.run(GpuMeterApplication.class, args);
    }
}
