package com.calai.nutrilabel.nutrient.source.upstream;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 每個 batch run 開一個新的 {@link UpstreamSession}
 */
@Component
public class UpstreamSessionFactory {

    private final UpstreamProperties props;
    private final UpstreamTelemetry telemetry;
    private final Sleeper sleeper;

    @Autowired
    public UpstreamSessionFactory(UpstreamProperties props, UpstreamTelemetry telemetry) {
        this(props, telemetry, Sleeper.THREAD);
    }

    UpstreamSessionFactory(UpstreamProperties props, UpstreamTelemetry telemetry, Sleeper sleeper) {
        this.props = props;
        this.telemetry = telemetry;
        this.sleeper = sleeper;
    }

    public UpstreamSession open() {
        return new UpstreamSession(
                UpstreamRetryPolicy.from(props),
                telemetry,
                sleeper,
                props.cacheMaxEntriesOrDefault()
        );
    }
}
