package com.mailmirror.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailmirror.domain.Account;
import com.mailmirror.domain.DeviceAuthChallenge;
import com.mailmirror.domain.OAuthToken;
import com.mailmirror.exception.AuthException;
import com.mailmirror.exception.BrokerException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;

/**
 * Token backend on an MQTT broker
 * - Token stored as a retained message on modernauth/{clientId}/{accountKey}/token
 * - Authorization prompt published as a Home Assistant MQTT event (discovery config + state)
 * - Every operation connects, does one subscribe/publish and disconnects, under the client id's lock
 */
@Slf4j
public class MqttTokenBackend implements TokenBackend {

    private static final int QOS = 0;

    private final String name;
    private final String accountKey;
    private final String serverUri;
    private final String clientId;
    private final MqttConnectOptions options;
    private final MqttClientFactory clientFactory;
    private final Lock lock;
    private final Duration loadTimeout;
    private final Duration disconnectTimeout;
    private final ObjectMapper mapper;

    public MqttTokenBackend(String name, Settings settings, MqttClientFactory clientFactory, Lock lock,
            ObjectMapper mapper) {
        this.name = name;
        this.accountKey = Account.keyOf(name);
        this.serverUri = settings.serverUri();
        this.clientId = settings.clientId();
        this.options = settings.options();
        this.clientFactory = clientFactory;
        this.lock = lock;
        this.loadTimeout = settings.loadTimeout();
        this.disconnectTimeout = settings.disconnectTimeout();
        this.mapper = mapper;
    }

    /**
     * Broker connection settings shared by all backends of one client id
     */
    public record Settings(String serverUri, String clientId, MqttConnectOptions options, Duration loadTimeout,
            Duration disconnectTimeout) {
    }

    public String tokenTopic() {
        return "modernauth/" + clientId + "/" + accountKey + "/token";
    }

    public String eventTopic() {
        return "homeassistant/event/" + clientId + "/" + accountKey;
    }

    @Override
    public Optional<OAuthToken> loadToken() throws AuthException, BrokerException {
        return withClient(client -> {
            CompletableFuture<OAuthToken> received = new CompletableFuture<>();
            client.subscribe(tokenTopic(), QOS, (topic, message) -> {
                if (message.getPayload().length == 0) {
                    return;
                }
                try {
                    received.complete(mapper.readValue(message.getPayload(), OAuthToken.class));
                } catch (IOException e) {
                    received.completeExceptionally(e);
                }
            });

            try {
                return Optional.of(received.get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                log.debug("{}: No retained token on {}", name, tokenTopic());
                return Optional.empty();
            } catch (ExecutionException e) {
                throw new AuthException("Stored token of " + name + " is unreadable", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerException("Interrupted while loading the token of " + name, e);
            }
        });
    }

    @Override
    public void saveToken(OAuthToken token) throws AuthException, BrokerException {
        byte[] payload = toJson(token);
        withClient(client -> {
            client.publish(tokenTopic(), payload, QOS, true);
            log.debug("{}: Token saved to {}", name, tokenTopic());
            return null;
        });
    }

    @Override
    public void notify(DeviceAuthChallenge challenge) throws AuthException, BrokerException {
        String base = eventTopic();

        Map<String, Object> device = new LinkedHashMap<>();
        device.put("identifiers", List.of(clientId));
        device.put("name", name);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("~", base);
        config.put("name", name);
        config.put("event_types", List.of("auth"));
        config.put("state_topic", "~/state");
        config.put("unique_id", clientId + "-" + accountKey);
        config.put("device", device);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event_type", "auth");
        event.put("link", challenge.verificationUri().toString());
        event.put("code", challenge.userCode());

        byte[] configPayload = toJson(config);
        byte[] eventPayload = toJson(event);
        withClient(client -> {
            client.publish(base + "/config", configPayload, QOS, false);
            client.publish(base + "/state", eventPayload, QOS, false);
            log.info("{}: Authorization prompt published to {}", name, base);
            return null;
        });
    }

    private <T> T withClient(BrokerAction<T> action) throws AuthException, BrokerException {
        lock.lock();
        try {
            IMqttClient client = connect();
            try {
                return action.apply(client);
            } catch (MqttException e) {
                throw new BrokerException("MQTT operation for " + name + " failed: " + e.getMessage(), e);
            } finally {
                disconnect(client);
            }
        } finally {
            lock.unlock();
        }
    }

    private IMqttClient connect() throws BrokerException {
        IMqttClient client;
        try {
            client = clientFactory.create(serverUri, clientId);
        } catch (MqttException e) {
            throw new BrokerException("Cannot create MQTT client for " + serverUri + ": " + e.getMessage(), e);
        }
        try {
            client.connect(options);
            return client;
        } catch (MqttException e) {
            closeQuietly(client);
            throw new BrokerException("Connecting to MQTT broker " + serverUri + " failed: " + e.getMessage(), e);
        }
    }

    private void disconnect(IMqttClient client) {
        try {
            if (client.isConnected()) {
                client.disconnect(disconnectTimeout.toMillis());
            }
        } catch (MqttException e) {
            log.warn("{}: MQTT disconnect failed: {}", name, e.getMessage());
        }
        closeQuietly(client);
    }

    private void closeQuietly(IMqttClient client) {
        try {
            client.close();
        } catch (MqttException e) {
            log.debug("{}: MQTT client close failed: {}", name, e.getMessage());
        }
    }

    private byte[] toJson(Object value) throws AuthException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new AuthException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    @FunctionalInterface
    private interface BrokerAction<T> {
        T apply(IMqttClient client) throws MqttException, AuthException, BrokerException;
    }
}
