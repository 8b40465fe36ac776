package com.teambind.lottery.common.exceptions;

import com.teambind.lottery.domain.exception.InconsistentStateException;
import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * GlobalExceptionHandler 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler 테스트")
class GlobalExceptionHandlerTest {

    @InjectMocks
    private GlobalExceptionHandler exceptionHandler;

    @Mock
    private HttpServletRequest request;

    @Test
    @DisplayName("정합성 예외는 500 과 INCONSISTENT_STATE 코드로 응답한다")
    void handleInconsistentState() {
        // given
        when(request.getRequestURI()).thenReturn("/api/admin/submissions/1/reward");
        InconsistentStateException exception =
                new InconsistentStateException("remove", 1L, "리워드 해제 후 응모 배정 정보를 비우지 못했습니다");

        // when
        ResponseEntity<ErrorResponse> response = exceptionHandler.handleInconsistentState(exception, request);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getCode()).isEqualTo("INCONSISTENT_STATE");
        assertThat(response.getBody().getMessage()).contains("응모 배정 정보");
        assertThat(response.getBody().getPath()).isEqualTo("/api/admin/submissions/1/reward");
    }

    @Test
    @DisplayName("요청 속도 제한 예외는 429")
    void handleRateLimit() {
        when(request.getRequestURI()).thenReturn("/api/coupons/ABC23456/redeem");

        ResponseEntity<ErrorResponse> response = exceptionHandler.handleCustomException(
                new CustomException(ErrorCode.RATE_LIMIT_EXCEEDED), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody().getCode()).isEqualTo("RATE_LIMIT_EXCEEDED");
    }

    @Test
    @DisplayName("처리되지 않은 예외는 내부 메시지를 노출하지 않는다")
    void handleGeneralException() {
        when(request.getRequestURI()).thenReturn("/api/coupons/ABC23456/redeem");

        ResponseEntity<ErrorResponse> response = exceptionHandler.handleGeneralException(
                new IllegalStateException("connection pool exhausted"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).isEqualTo(ErrorCode.INTERNAL_ERROR.getDefaultMessage());
    }

    @Test
    @DisplayName("입력 검증 실패는 필드별 메시지를 담아 400 으로 응답한다")
    void handleValidation() {
        WebRequest webRequest = mock(WebRequest.class);
        when(webRequest.getDescription(false)).thenReturn("uri=/api/coupons/ABC23456/redeem");

        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "email", "이메일 형식이 올바르지 않습니다"));
        MethodArgumentNotValidException exception =
                new MethodArgumentNotValidException(mock(MethodParameter.class), bindingResult);

        ResponseEntity<Object> response = exceptionHandler.handleMethodArgumentNotValid(
                exception, new HttpHeaders(), HttpStatus.BAD_REQUEST, webRequest);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ErrorResponse body = (ErrorResponse) response.getBody();
        assertThat(body.getFieldErrors()).containsEntry("email", "이메일 형식이 올바르지 않습니다");
        assertThat(body.getPath()).isEqualTo("/api/coupons/ABC23456/redeem");
    }
}
