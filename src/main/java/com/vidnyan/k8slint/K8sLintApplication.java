package com.vidnyan.k8slint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * k8s-lint: linter and auto-fixer for Kubernetes resources declared in Go.
 */
@SpringBootApplication
public class K8sLintApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(K8sLintApplication.class, args)));
    }
}
