package org.nowstart.copytrade.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import feign.FeignException;
import feign.Request;
import feign.Response;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.nowstart.copytrade.data.exception.CopyTradeApiException;
import org.nowstart.copytrade.data.exception.PositionSizingException;
import org.nowstart.copytrade.data.type.SizingRejectionReason;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

class CopyTradeExceptionHandlerTest {

    private final CopyTradeExceptionHandler handler = new CopyTradeExceptionHandler();

    @Test
    void handleCopyTradeApiException_returnsProblemDetailWithCode() {
        CopyTradeApiException exception = new CopyTradeApiException(HttpStatus.NOT_FOUND, "primary_trade_not_found", "Primary trade not found");

        ProblemDetail detail = handler.handleCopyTradeApiException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
        assertThat(detail.getDetail()).isEqualTo("Primary trade not found");
        assertThat(detail.getProperties()).containsEntry("code", "primary_trade_not_found");
    }

    @Test
    void handlePositionSizingException_mapsReasonToUnprocessableEntity() {
        PositionSizingException exception = new PositionSizingException(
                SizingRejectionReason.POSITION_TOO_SMALL,
                "Position notional 1 is below exchange minimum 5"
        );

        ProblemDetail detail = handler.handlePositionSizingException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY.value());
        assertThat(detail.getDetail()).contains("below exchange minimum");
        assertThat(detail.getProperties()).containsEntry("code", "sizing_position_too_small");
    }

    @Test
    void handleUnexpectedException_returnsInternalErrorProblemDetail() {
        ProblemDetail detail = handler.handleUnexpectedException();

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
        assertThat(detail.getDetail()).isEqualTo("Unexpected server error");
        assertThat(detail.getProperties()).containsEntry("code", "internal_error");
    }

    @Test
    void handleFeignException_includesUpstreamBodyAndStatus() {
        Request request = Request.create(
                Request.HttpMethod.POST,
                "/exchange/v1/derivatives/futures/orders/create",
                Map.of(),
                null,
                StandardCharsets.UTF_8,
                null
        );
        Response response = Response.builder()
                .status(400)
                .reason("Bad Request")
                .request(request)
                .headers(Map.of())
                .body("{\"message\":\"Invalid quantity\"}", StandardCharsets.UTF_8)
                .build();
        FeignException exception = FeignException.errorStatus("CoinDcxFeignClient#createOrder", response);

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getDetail()).contains("Invalid quantity");
        assertThat(detail.getProperties()).containsEntry("code", "venue_error");
        assertThat(detail.getProperties()).containsEntry("upstreamStatus", 400);
    }

    @Test
    void handleFeignException_fallsBackToBadGatewayWhenStatusUnknown() {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(520);
        when(exception.contentUTF8()).thenReturn("{\"message\":\"upstream\"}");

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY.value());
        assertThat(detail.getDetail()).contains("upstream");
        assertThat(detail.getProperties()).containsEntry("upstreamStatus", 520);
    }

    @Test
    void handleFeignException_usesDefaultDetailWhenBodyAndMessageBlank() {
        FeignException exception = mock(FeignException.class);
        when(exception.status()).thenReturn(400);
        when(exception.contentUTF8()).thenReturn(" ");
        when(exception.getMessage()).thenReturn(" ");

        ProblemDetail detail = handler.handleFeignException(exception);

        assertThat(detail.getDetail()).isEqualTo("CoinDCX API request failed");
    }

    @Test
    void handleValidationException_returnsValidationDetails() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ValidationTarget(), "target");
        bindingResult.addError(new FieldError("target", "pair", "pair is required"));
        MethodParameter methodParameter = new MethodParameter(
                CopyTradeExceptionHandlerTest.class.getDeclaredMethod("dummyValidationMethod", ValidationTarget.class),
                0
        );
        MethodArgumentNotValidException exception = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ProblemDetail detail = handler.handleValidationException(exception);

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("code", "validation_error");
        assertThat(detail.getProperties()).containsEntry("details", List.of("pair is required"));
    }

    @Test
    void handleConstraintViolationException_returnsValidationDetails() {
        @SuppressWarnings("unchecked")
        ConstraintViolation<Object> violation = (ConstraintViolation<Object>) mock(ConstraintViolation.class);
        when(violation.getMessage()).thenReturn("followerId must not be blank");

        ProblemDetail detail = handler.handleConstraintViolationException(new ConstraintViolationException(Set.of(violation)));

        assertThat(detail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
        assertThat(detail.getProperties()).containsEntry("details", List.of("followerId must not be blank"));
    }

    @SuppressWarnings("unused")
    private void dummyValidationMethod(ValidationTarget target) {
    }

    private static final class ValidationTarget {
        private String pair;
    }
}
