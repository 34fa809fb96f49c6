package com.agentverse.authz;

import com.agentverse.authz.config.AuthzProperties;
import com.agentverse.authz.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Agentverse authorization service.
 *
 * <p>Decides who may see and manage groups, memberships and agents, and answers permission
 * checks for the rest of the platform. Caller identities arrive already verified from the
 * gateway.
 */
@SpringBootApplication
@EnableConfigurationProperties({ServiceProperties.class, AuthzProperties.class})
public class AuthzServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthzServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthzServiceApplication.class, args);
        log.info("Agentverse authz service started");
    }
}
