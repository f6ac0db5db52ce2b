package ca.gc.cra.relay.application.relay;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.domain.relay.RelayResult;
import ca.gc.cra.relay.domain.relay.RelaySide;

final class RelayMetrics {
  private final MetricsPort metrics;

  RelayMetrics(MetricsPort metrics) {
    this.metrics = metrics;
  }

  void onForwarded(RelaySide from, int n) {
    metrics.observe("relay.bytes." + from.forwardMetricSuffix(), n);
  }

  void onResponseHeadRewritten() {
    metrics.increment("relay.response.rewritten");
  }

  void onCompleted(RelayResult result) {
    metrics.increment("relay.exchange.completed");
    metrics.observe("relay.exchange.clientToTarget", result.clientToTargetBytes());
    metrics.observe("relay.exchange.targetToClient", result.targetToClientBytes());
  }
}
