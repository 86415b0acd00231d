package com.mailmirror;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * mailmirror
 *
 * Moves mail from source IMAP mailboxes to target IMAP mailboxes
 * - IDLE-driven, with NOOP polling fallback
 * - fetch/store/cleanup pipeline per change
 * - OAuth2 device authorization with tokens kept on an MQTT broker
 * - Reactor-based account supervision
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@EnableConfigurationProperties
public class MailMirrorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailMirrorApplication.class, args);
    }
}
