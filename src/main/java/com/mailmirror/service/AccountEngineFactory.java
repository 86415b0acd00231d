package com.mailmirror.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailmirror.auth.BrokerLocks;
import com.mailmirror.auth.DeviceAuthTokenSource;
import com.mailmirror.auth.MqttClientFactory;
import com.mailmirror.auth.MqttTokenBackend;
import com.mailmirror.auth.NimbusDeviceAuthorizationClient;
import com.mailmirror.auth.TokenSource;
import com.mailmirror.config.MirrorProperties;
import com.mailmirror.domain.Account;
import com.mailmirror.domain.MailStoreCredentials;
import com.mailmirror.exception.ConfigException;
import com.mailmirror.imap.ConnectionManager;
import lombok.RequiredArgsConstructor;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Wires one engine per account, with its own token source when a side logs in with OAuth2
 */
@Component
@RequiredArgsConstructor
public class AccountEngineFactory {

    private final MirrorProperties properties;
    private final MqttClientFactory mqttClientFactory;
    private final MqttConnectOptions mqttConnectOptions;
    private final BrokerLocks brokerLocks;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AccountEngine create(Account account) {
        ConnectionManager connections = new ConnectionManager(properties.getImap(), tokenSourceFor(account));
        return new AccountEngine(account, connections, properties.getIdleFallback(), properties.getQueueCapacity());
    }

    TokenSource tokenSourceFor(Account account) {
        MailStoreCredentials bearer = null;
        if (account.getSource().credentials().usesBearerToken()) {
            bearer = account.getSource().credentials();
        } else if (account.getTarget().credentials().usesBearerToken()) {
            bearer = account.getTarget().credentials();
        }
        if (bearer == null) {
            return null;
        }

        MirrorProperties.Provider provider = properties.getOauth2().getProviders().get(bearer.oauth2Provider());
        if (provider == null) {
            throw new ConfigException(account.getName() + ": unknown OAuth2 provider " + bearer.oauth2Provider());
        }
        MirrorProperties.Mqtt mqtt = properties.getMqtt();
        MqttTokenBackend.Settings settings = new MqttTokenBackend.Settings(mqtt.getBrokerUrl(), mqtt.getClientId(),
                mqttConnectOptions, mqtt.getLoadTimeout(), mqtt.getDisconnectTimeout());

        return new DeviceAuthTokenSource(account.getName(),
                new NimbusDeviceAuthorizationClient(provider, properties.getOauth2().getHttpTimeout(), clock),
                new MqttTokenBackend(account.getName(), settings, mqttClientFactory,
                        brokerLocks.forClient(mqtt.getClientId()), objectMapper));
    }
}
