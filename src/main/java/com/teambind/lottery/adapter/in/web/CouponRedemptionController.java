package com.teambind.lottery.adapter.in.web;

import com.teambind.lottery.adapter.in.web.dto.OperationResponse;
import com.teambind.lottery.adapter.in.web.dto.RedeemCouponRequest;
import com.teambind.lottery.adapter.in.web.dto.SubmissionResponse;
import com.teambind.lottery.application.port.in.RedeemCouponCommand;
import com.teambind.lottery.application.port.in.RedeemCouponUseCase;
import com.teambind.lottery.application.port.in.RedeemCouponUseCase.RedemptionResult;
import com.teambind.lottery.domain.model.ClientMeta;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 쿠폰 사용(응모) API
 */
@Slf4j
@RestController
@RequestMapping("/api/coupons")
@RequiredArgsConstructor
public class CouponRedemptionController {

    private final RedeemCouponUseCase redeemCouponUseCase;

    @PostMapping("/{code}/redeem")
    public ResponseEntity<OperationResponse<SubmissionResponse>> redeem(
            @PathVariable String code,
            @Valid @RequestBody RedeemCouponRequest request,
            HttpServletRequest httpRequest) {

        ClientMeta clientMeta = ClientMeta.of(
                ClientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));

        RedemptionResult result = redeemCouponUseCase.redeem(
                RedeemCouponCommand.of(code.trim().toUpperCase(), request.toFields(), clientMeta));

        if (result.isSuccess()) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(OperationResponse.success(SubmissionResponse.from(result.getSubmission())));
        }

        return ResponseEntity.status(ResultStatusMapper.toStatus(result.getErrorKind(), result.getReason()))
                .body(OperationResponse.failure(result.getReason(), result.getErrorKind(), result.getMessage()));
    }
}
