package org.iceforge.sluice;

import org.iceforge.sluice.governance.GovernanceProperties;
import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({GovernanceProperties.class, DatabaseProperties.class})
public class SluiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(SluiceApplication.class, args);
	}
}
