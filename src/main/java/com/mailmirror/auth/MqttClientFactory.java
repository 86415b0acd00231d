package com.mailmirror.auth;

import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;

/**
 * Creates a fresh, unconnected MQTT client for one broker operation
 */
@FunctionalInterface
public interface MqttClientFactory {

    IMqttClient create(String serverUri, String clientId) throws MqttException;
}
