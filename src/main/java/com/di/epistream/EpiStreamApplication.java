package com.di.epistream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.di.epistream.config.EpiStreamProperties;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
@EnableConfigurationProperties(EpiStreamProperties.class)
public class EpiStreamApplication {

	public static void main(String[] args) {
		// the pipeline runs from an ApplicationRunner; its outcome becomes the exit code
		System.exit(SpringApplication.exit(SpringApplication.run(EpiStreamApplication.class, args)));
	}
}
