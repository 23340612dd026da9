package com.xammer.cloudaudit.service;

import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ProcessTerminator {

    private final ApplicationContext context;

    public ProcessTerminator(ApplicationContext context) {
        this.context = context;
    }

    public void terminate(int status) {
        System.exit(SpringApplication.exit(context, () -> status));
    }
}
