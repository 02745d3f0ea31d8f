package com.wpanther.licensing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TenantLicensingApplication {

    public static void main(String[] args) {
        SpringApplication.run(TenantLicensingApplication.class, args);
    }

}
