package com.contacts.merger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// the secondary database is opened per request, so no DataSource is auto-configured
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class MergerApplication {

	public static void main(String[] args) {
		SpringApplication.run(MergerApplication.class, args);
	}

}
