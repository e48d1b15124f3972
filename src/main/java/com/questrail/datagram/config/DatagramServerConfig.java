package com.questrail.datagram.config;

import com.questrail.datagram.api.Binder;
import com.questrail.datagram.api.NetworkFamily;
import com.questrail.datagram.api.RequestHandler;
import com.questrail.datagram.api.ResponseHandler;
import com.questrail.datagram.observability.DatagramServerObservabilitySink;
import com.questrail.datagram.observability.Slf4jDatagramServerObservabilitySink;

/**
 * Aggregated configuration for a datagram server.
 *
 * <p>This record only stores values. Validation happens in
 * {@code DatagramServer.create}, which rejects the whole configuration with an
 * {@code InvalidConfigException} naming the first offending field.</p>
 *
 * @param network          network family name: {@code udp}, {@code udp4} or {@code udp6}
 * @param bindAddress      {@code host:port}; empty host means wildcard, port 0 or omitted means OS-assigned
 * @param binder           produces the bound socket during start
 * @param requestHandler   interprets datagrams and decides on replies
 * @param responseHandler  writes replies
 * @param poolPolicy       worker, queue and shutdown sizing
 * @param observabilitySink receives lifecycle milestones and isolated failures
 */
public record DatagramServerConfig(
    String network,
    String bindAddress,
    Binder binder,
    RequestHandler requestHandler,
    ResponseHandler responseHandler,
    WorkerPoolPolicy poolPolicy,
    DatagramServerObservabilitySink observabilitySink
) {
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String network = NetworkFamily.UDP.networkName();
        private String bindAddress = ":0";
        private Binder binder;
        private RequestHandler requestHandler;
        private ResponseHandler responseHandler;
        private WorkerPoolPolicy poolPolicy = WorkerPoolPolicy.defaults();
        private DatagramServerObservabilitySink observabilitySink = Slf4jDatagramServerObservabilitySink.INSTANCE;

        public Builder withNetwork(String network) {
            this.network = network;
            return this;
        }

        public Builder withNetwork(NetworkFamily family) {
            this.network = family == null ? null : family.networkName();
            return this;
        }

        public Builder withBindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withBinder(Binder binder) {
            this.binder = binder;
            return this;
        }

        public Builder withRequestHandler(RequestHandler requestHandler) {
            this.requestHandler = requestHandler;
            return this;
        }

        public Builder withResponseHandler(ResponseHandler responseHandler) {
            this.responseHandler = responseHandler;
            return this;
        }

        public Builder withPoolPolicy(WorkerPoolPolicy poolPolicy) {
            this.poolPolicy = poolPolicy;
            return this;
        }

        public Builder withObservabilitySink(DatagramServerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public DatagramServerConfig build() {
            return new DatagramServerConfig(
                network,
                bindAddress,
                binder,
                requestHandler,
                responseHandler,
                poolPolicy,
                observabilitySink
            );
        }
    }
}
