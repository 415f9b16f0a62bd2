package org.iceforge.warden.server;

import org.iceforge.warden.server.config.WardenProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(WardenProperties.class)
public class WardenApplication {

	public static void main(String[] args) {
		SpringApplication.run(WardenApplication.class, args);
	}
}
