package com.teambind.lottery.application.port.in;

import com.teambind.lottery.domain.model.ClientMeta;
import com.teambind.lottery.domain.model.SubmissionFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * 쿠폰 사용(응모) 커맨드
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
@Builder
@EqualsAndHashCode
public class RedeemCouponCommand {

    @NotBlank(message = "쿠폰 코드는 필수입니다")
    private String code;

    @NotNull(message = "응모 정보는 필수입니다")
    private SubmissionFields fields;

    private ClientMeta clientMeta;

    public static RedeemCouponCommand of(String code, SubmissionFields fields, ClientMeta clientMeta) {
        return RedeemCouponCommand.builder()
                .code(code)
                .fields(fields)
                .clientMeta(clientMeta)
                .build();
    }
}
