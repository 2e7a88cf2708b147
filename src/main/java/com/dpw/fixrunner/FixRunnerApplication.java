package com.dpw.fixrunner;

import com.dpw.fixrunner.config.FixRunnerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@EnableConfigurationProperties(FixRunnerProperties.class)
@ComponentScan(basePackages = {"com.dpw.fixrunner"})
public class FixRunnerApplication {

	public static void main(String[] args) {
		SpringApplication.run(FixRunnerApplication.class, args);
	}
}
