package org.iceforge.warden.server.demo.h2;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.sql.DataSource;

@Configuration
@ConditionalOnProperty(prefix = "warden.demo.h2", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(DemoH2Properties.class)
public class DemoH2Config {

    @Bean
    public DemoH2Seeder demoH2Seeder(@Qualifier("wardenAdminDataSource") DataSource admin, DemoH2Properties props,
                                     PasswordEncoder passwordEncoder) {
        return new DemoH2Seeder(admin, props, passwordEncoder);
    }

    @Bean
    public ApplicationRunner demoH2SeedRunner(DemoH2Seeder seeder) {
        return args -> seeder.seed();
    }
}
