package com.integration.mergequeue;

import com.integration.mergequeue.config.MergeQueueProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MergeQueueProperties.class)
public class MergeQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(MergeQueueApplication.class, args);
    }
}
