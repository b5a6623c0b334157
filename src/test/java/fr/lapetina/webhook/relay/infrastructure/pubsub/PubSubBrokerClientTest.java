package fr.lapetina.webhook.relay.infrastructure.pubsub;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import fr.lapetina.webhook.relay.domain.model.FailureCause;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class PubSubBrokerClientTest {

    private static ApiException apiException(StatusCode.Code code) {
        StatusCode statusCode = new StatusCode() {
            @Override
            public Code getCode() {
                return code;
            }

            @Override
            public Object getTransportCode() {
                return code.name();
            }
        };
        return new ApiException(new IOException(code.name()), statusCode, false);
    }

    @Test
    @DisplayName("should map invalid argument to invalid payload")
    void shouldMapInvalidArgument() {
        BrokerException exception = PubSubBrokerClient.classify(apiException(StatusCode.Code.INVALID_ARGUMENT));

        assertThat(exception.getFailureCause()).isEqualTo(FailureCause.INVALID_PAYLOAD);
    }

    @Test
    @DisplayName("should map other broker statuses to broker unavailable")
    void shouldMapOtherStatuses() {
        assertThat(PubSubBrokerClient.classify(apiException(StatusCode.Code.PERMISSION_DENIED)).getFailureCause())
                .isEqualTo(FailureCause.BROKER_UNAVAILABLE);
        assertThat(PubSubBrokerClient.classify(apiException(StatusCode.Code.NOT_FOUND)).getFailureCause())
                .isEqualTo(FailureCause.BROKER_UNAVAILABLE);
        assertThat(PubSubBrokerClient.classify(apiException(StatusCode.Code.UNAVAILABLE)).getFailureCause())
                .isEqualTo(FailureCause.BROKER_UNAVAILABLE);
    }

    @Test
    @DisplayName("should map anything else to unknown")
    void shouldMapUnknown() {
        BrokerException exception = PubSubBrokerClient.classify(new IllegalStateException("boom"));

        assertThat(exception.getFailureCause()).isEqualTo(FailureCause.UNKNOWN);
        assertThat(exception).hasCauseInstanceOf(IllegalStateException.class);
    }
}
