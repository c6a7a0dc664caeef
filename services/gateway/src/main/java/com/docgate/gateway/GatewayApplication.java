package com.docgate.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DocGate gateway: virtual {@code users} and {@code tenants} tables on top of a document database.
 *
 * <p>The HTTP layer and token verification live in front of this process; everything here is
 * exposed as plain method calls on {@link com.docgate.gateway.table.VirtualTableHandler}.
 */
@SpringBootApplication
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
        log.info("DocGate gateway started");
    }
}
