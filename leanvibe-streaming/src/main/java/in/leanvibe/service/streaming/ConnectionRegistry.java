package in.leanvibe.service.streaming;

import in.leanvibe.domain.client.ClientInfo;
import in.leanvibe.domain.client.ClientPreferences;
import in.leanvibe.domain.client.ConnectionState;
import in.leanvibe.transport.ClientTransport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns per-client connection state and the transport handle.
 */
public final class ConnectionRegistry {

    /**
     * A registered client: its state plus the transport currently bound to it.
     * The transport is swapped when a dropped client reconnects.
     */
    public static final class RegisteredClient {
        private final ConnectionState state;
        private volatile ClientTransport transport;

        RegisteredClient(ConnectionState state, ClientTransport transport) {
            this.state = state;
            this.transport = transport;
        }

        public String clientId() {
            return state.getClientId();
        }

        public ConnectionState state() {
            return state;
        }

        public ClientTransport transport() {
            return transport;
        }

        void bindTransport(ClientTransport transport) {
            this.transport = transport;
        }
    }

    private final Map<String, RegisteredClient> clients = new ConcurrentHashMap<>();

    /**
     * Register or replace a client.
     *
     * @return the previous registration, or null
     */
    RegisteredClient register(String clientId, ClientTransport transport, ClientPreferences preferences) {
        RegisteredClient client = new RegisteredClient(new ConnectionState(clientId, preferences), transport);
        return clients.put(clientId, client);
    }

    RegisteredClient remove(String clientId) {
        return clients.remove(clientId);
    }

    public RegisteredClient get(String clientId) {
        return clients.get(clientId);
    }

    public boolean contains(String clientId) {
        return clients.containsKey(clientId);
    }

    public Collection<RegisteredClient> clients() {
        return List.copyOf(clients.values());
    }

    public int size() {
        return clients.size();
    }

    public int activeCount() {
        int active = 0;
        for (RegisteredClient client : clients.values()) {
            if (client.state().isActive()) {
                active++;
            }
        }
        return active;
    }

    public Map<String, ClientInfo> snapshot() {
        List<String> ids = new ArrayList<>(clients.keySet());
        ids.sort(String::compareTo);
        Map<String, ClientInfo> info = new LinkedHashMap<>();
        for (String id : ids) {
            RegisteredClient client = clients.get(id);
            if (client != null) {
                info.put(id, client.state().snapshot());
            }
        }
        return info;
    }
}
