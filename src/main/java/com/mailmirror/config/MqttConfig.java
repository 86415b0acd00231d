package com.mailmirror.config;

import com.mailmirror.auth.BrokerLocks;
import com.mailmirror.auth.MqttClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * MQTT broker configuration (token store and Home Assistant notifications)
 */
@Slf4j
@Configuration
public class MqttConfig {

    @Bean
    public MqttClientFactory mqttClientFactory() {
        return (serverUri, clientId) -> new MqttClient(serverUri, clientId, new MemoryPersistence());
    }

    @Bean
    public MqttConnectOptions mqttConnectOptions(MirrorProperties properties) {
        MirrorProperties.Mqtt mqtt = properties.getMqtt();
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        if (mqtt.getUsername() != null && !mqtt.getUsername().isBlank()) {
            options.setUserName(mqtt.getUsername());
            if (mqtt.getPassword() != null && !mqtt.getPassword().isEmpty()) {
                options.setPassword(mqtt.getPassword().toCharArray());
            }
        }
        if (mqtt.isConfigured()) {
            log.info("MQTT broker configured: {} (client id {})", mqtt.getBrokerUrl(), mqtt.getClientId());
        }
        return options;
    }

    @Bean
    public BrokerLocks brokerLocks() {
        return new BrokerLocks();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
