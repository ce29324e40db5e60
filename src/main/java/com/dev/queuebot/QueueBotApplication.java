package com.dev.queuebot;

import com.dev.queuebot.config.QueueBotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(QueueBotProperties.class)
public class QueueBotApplication {

	public static void main(String[] args) {
		SpringApplication.run(QueueBotApplication.class, args);
	}

}
