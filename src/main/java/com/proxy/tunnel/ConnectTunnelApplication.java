package com.proxy.tunnel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConnectTunnelApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConnectTunnelApplication.class, args);
    }
}
