package com.vdbfuzz.adapter;

import com.vdbfuzz.model.ErrorKind;
import com.vdbfuzz.model.Metric;

/** The service cannot answer a search with the requested metric; no other metric is substituted. */
public class UnsupportedMetricException extends AdapterException {

    private final Metric metric;

    public UnsupportedMetricException(String service, Metric metric, String reason) {
        super(service, service + " cannot search with metric " + metric.getWireName() + ": " + reason, null, null, null);
        this.metric = metric;
    }

    public Metric getMetric() {
        return metric;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNSUPPORTED_METRIC;
    }
}
