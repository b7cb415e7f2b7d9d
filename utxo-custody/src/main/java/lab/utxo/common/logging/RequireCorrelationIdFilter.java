package lab.utxo.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import lab.utxo.common.CorrelationIdFilter;

import java.util.Map;

/**
 * Passes only events logged inside an HTTP request, i.e. with a correlation id in the MDC.
 * Keeps startup and executor noise out of the withdrawal trail file.
 */
public class RequireCorrelationIdFilter extends Filter<ILoggingEvent> {

    private String mdcKey = CorrelationIdFilter.MDC_CORRELATION_ID_KEY;

    // Settable from logback-spring.xml.
    public void setMdcKey(String mdcKey) {
        this.mdcKey = mdcKey;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null || !isStarted()) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        String value = mdc == null ? null : mdc.get(mdcKey);
        return value == null || value.isBlank() ? FilterReply.DENY : FilterReply.NEUTRAL;
    }
}
