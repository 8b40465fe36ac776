package com.teambind.lottery.adapter.out.persistence.repository;

import com.teambind.lottery.adapter.out.persistence.entity.CouponEntity;
import com.teambind.lottery.domain.model.CouponStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 쿠폰 JPA Repository
 * 상태 전이는 모두 "현재 상태 = from" 조건이 걸린 업데이트이며 영향받은 행 수로 성공 여부를 판단한다
 */
public interface CouponRepository extends JpaRepository<CouponEntity, Long> {

    Optional<CouponEntity> findByCode(String code);

    @Query("SELECT c.status FROM CouponEntity c WHERE c.id = :id")
    Optional<CouponStatus> findStatusById(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CouponEntity c " +
            "SET c.status = :to, c.redeemedAt = :redeemedAt, c.redeemedBy = :redeemedBy, c.updatedAt = :redeemedAt " +
            "WHERE c.id = :id AND c.status = :from")
    int redeemIfStatus(@Param("id") Long id,
                       @Param("from") CouponStatus from,
                       @Param("to") CouponStatus to,
                       @Param("redeemedBy") String redeemedBy,
                       @Param("redeemedAt") LocalDateTime redeemedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CouponEntity c SET c.status = :to, c.updatedAt = :asOf " +
            "WHERE c.id = :id AND c.status = :from AND c.expiresAt IS NOT NULL AND c.expiresAt <= :asOf")
    int expireIfDue(@Param("id") Long id,
                    @Param("from") CouponStatus from,
                    @Param("to") CouponStatus to,
                    @Param("asOf") LocalDateTime asOf);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CouponEntity c SET c.status = :to, c.updatedAt = :asOf " +
            "WHERE c.status = :from AND c.expiresAt IS NOT NULL AND c.expiresAt <= :asOf")
    int expireAllDue(@Param("from") CouponStatus from,
                     @Param("to") CouponStatus to,
                     @Param("asOf") LocalDateTime asOf);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CouponEntity c SET c.status = :to, c.updatedAt = :at WHERE c.id = :id AND c.status = :from")
    int transitionIfStatus(@Param("id") Long id,
                           @Param("from") CouponStatus from,
                           @Param("to") CouponStatus to,
                           @Param("at") LocalDateTime at);

    @Query("SELECT c.status, COUNT(c) FROM CouponEntity c GROUP BY c.status")
    List<Object[]> countGroupByStatus();
}
