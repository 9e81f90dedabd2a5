package br.acquasys.infrastructure.mqtt;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Eclipse Paho MQTT v3 transport. Clean session, 10 s connect timeout, 60 s keep-alive;
 * automatic reconnect is left off because the ingress adapter schedules reconnects itself.
 */
public final class PahoDeviceTransport implements DeviceTransport {
    private static final Logger log = LoggerFactory.getLogger(PahoDeviceTransport.class);

    private final String brokerUri;
    private final String clientId;
    private final String username;
    private final String password;

    private volatile MqttClient client;
    private volatile Listener listener;

    public PahoDeviceTransport(String host, int port, String clientId, String username, String password) {
        this.brokerUri = "tcp://" + host + ":" + port;
        this.clientId = clientId;
        this.username = username;
        this.password = password;
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void connect() {
        close();
        try {
            MqttClient mqtt = new MqttClient(brokerUri, clientId, new MemoryPersistence());
            mqtt.setCallback(new MqttCallback() {
                @Override
                public void connectionLost(Throwable cause) {
                    Listener l = listener;
                    if (l != null) {
                        l.onConnectionLost(cause);
                    }
                }

                @Override
                public void messageArrived(String topic, MqttMessage message) {
                    Listener l = listener;
                    if (l != null) {
                        l.onMessage(topic, new String(message.getPayload(), StandardCharsets.UTF_8));
                    }
                }

                @Override
                public void deliveryComplete(IMqttDeliveryToken token) {
                    // QoS 1 acknowledgements need no handling
                }
            });

            MqttConnectOptions opts = new MqttConnectOptions();
            opts.setCleanSession(true);
            opts.setConnectionTimeout(10);
            opts.setKeepAliveInterval(60);
            opts.setAutomaticReconnect(false);
            if (username != null) {
                opts.setUserName(username);
                if (password != null) {
                    opts.setPassword(password.toCharArray());
                }
            }

            mqtt.connect(opts);
            this.client = mqtt;
            log.info("[MQTT] Connected to {} as {}", brokerUri, clientId);
        } catch (MqttException e) {
            throw new TransportConnectionException(brokerUri,
                "Connect failed (reason " + e.getReasonCode() + "): " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(List<String> topics) {
        MqttClient mqtt = requireClient();
        int[] qos = new int[topics.size()];
        Arrays.fill(qos, 1);
        try {
            mqtt.subscribe(topics.toArray(new String[0]), qos);
        } catch (MqttException e) {
            throw new TransportConnectionException(brokerUri, "Subscribe failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(String topic, String payload, int qos) {
        MqttClient mqtt = requireClient();
        MqttMessage message = new MqttMessage(payload.getBytes(StandardCharsets.UTF_8));
        message.setQos(qos);
        try {
            mqtt.publish(topic, message);
        } catch (MqttException e) {
            throw new TransportConnectionException(brokerUri, "Publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        MqttClient mqtt = client;
        return mqtt != null && mqtt.isConnected();
    }

    @Override
    public synchronized void close() {
        MqttClient mqtt = client;
        client = null;
        if (mqtt == null) {
            return;
        }
        try {
            if (mqtt.isConnected()) {
                mqtt.disconnect(2000);
            }
            mqtt.close();
        } catch (MqttException e) {
            log.debug("[MQTT] Error while closing client: {}", e.getMessage());
        }
    }

    @Override
    public String describe() {
        return brokerUri;
    }

    private MqttClient requireClient() {
        MqttClient mqtt = client;
        if (mqtt == null || !mqtt.isConnected()) {
            throw new TransportConnectionException(brokerUri, "Not connected");
        }
        return mqtt;
    }
}
