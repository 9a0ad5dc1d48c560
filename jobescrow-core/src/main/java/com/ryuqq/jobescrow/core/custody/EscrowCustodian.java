package com.ryuqq.jobescrow.core.custody;

import com.ryuqq.jobescrow.core.account.EscrowAccount;
import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.address.ProgramAddresses;
import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.Amounts;
import com.ryuqq.jobescrow.core.spi.Ledger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.UUID;

/**
 * 에스크로 커스터디언.
 *
 * <p>잡별 예치금을 보관하고, 프로그램 파생 권한으로만 지급합니다.
 * 의뢰인이나 프리랜서가 보유한 키로는 에스크로 자금을 이동할 수 없습니다.</p>
 *
 * <p><strong>지급 권한 흐름:</strong></p>
 * <pre>
 * 1. authorizeRelease(job)
 *    → 저장된 nonce로 에스크로 주소 재파생
 *    → 내부 키로 (id, jobPost, escrow, nonce, amount) HMAC 서명
 * 2. release(authorization, job, recipient)
 *    → 서명 검증 (외부에서 위조 불가)
 *    → 토큰이 이 잡과 재파생된 에스크로 주소에 묶여 있는지 확인
 *    → 잔액 == job.amount 확인 (아니면 ESCROW_MISMATCH)
 *    → 토큰 소비 (1회용)
 *    → 전액 이체
 * 3. close(job)
 *    → 비워진 에스크로 계정 종료
 * </pre>
 *
 * <p>금액과 잔액은 부호 없는 64비트 값이며 {@link Amounts}로 비교합니다.</p>
 *
 * <p>서명 키는 인스턴스 생성 시 {@link SecureRandom}으로 만들어지며 외부로 노출되지 않습니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class EscrowCustodian {

    private static final Logger log = LoggerFactory.getLogger(EscrowCustodian.class);
    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final int KEY_LENGTH_BYTES = 32;

    private final Ledger ledger;
    private final ProgramAddresses addresses;
    private final SecretKeySpec signingKey;

    /**
     * 생성자.
     *
     * @param ledger 잔액 원장
     * @param addresses 파생 주소 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EscrowCustodian(Ledger ledger, ProgramAddresses addresses) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        this.ledger = ledger;
        this.addresses = addresses;
        byte[] key = new byte[KEY_LENGTH_BYTES];
        new SecureRandom().nextBytes(key);
        this.signingKey = new SecretKeySpec(key, MAC_ALGORITHM);
    }

    /**
     * 신규 에스크로 계정 주소 결정 (자금 이동 없음).
     *
     * @param jobPost 잡 포스트 주소
     * @return 정규 nonce로 결정된 에스크로 레코드
     */
    public EscrowAccount reserve(AccountAddress jobPost) {
        return addresses.findEscrow(jobPost, candidate -> !ledger.exists(candidate));
    }

    /**
     * 예치 가능 여부 검증 (자금 이동 없음).
     *
     * @param funder 예치자
     * @param amount 예치 금액
     * @throws MarketplaceException 잔액 부족 시 (INSUFFICIENT_FUNDS)
     */
    public void requireFunds(AccountAddress funder, long amount) {
        long balance = ledger.balanceOf(funder);
        if (Amounts.isLessThan(balance, amount)) {
            throw new MarketplaceException(MarketplaceErrorCode.INSUFFICIENT_FUNDS,
                Amounts.format(balance), Amounts.format(amount));
        }
    }

    /**
     * 예치자 잔액에서 에스크로로 금액 이동.
     *
     * @param escrow {@link #reserve}로 결정된 에스크로
     * @param funder 예치자
     * @param amount 예치 금액
     * @throws MarketplaceException 잔액 부족 시 (INSUFFICIENT_FUNDS)
     */
    public void deposit(EscrowAccount escrow, AccountAddress funder, long amount) {
        ledger.transfer(funder, escrow.address(), amount);
        log.debug("Deposited {} from {} into escrow {}", Amounts.format(amount), funder, escrow.address());
    }

    /**
     * 잡의 에스크로 레코드 재파생.
     *
     * @param job 잡 포스트
     * @return 에스크로 레코드
     */
    public EscrowAccount escrowOf(JobPost job) {
        AccountAddress escrow = addresses.escrow(job.address(), job.escrowNonce());
        return new EscrowAccount(escrow, job.address(), job.escrowNonce());
    }

    /**
     * 잡의 에스크로 잔액.
     *
     * @param job 잡 포스트
     * @return 잔액 (지급 후 0)
     */
    public long balanceOf(JobPost job) {
        return ledger.balanceOf(escrowOf(job).address());
    }

    /**
     * 에스크로 잔액이 잡 금액과 일치하는지 검증.
     *
     * @param job 잡 포스트
     * @throws MarketplaceException 불일치 시 (ESCROW_MISMATCH)
     */
    public void requireFullyFunded(JobPost job) {
        long balance = balanceOf(job);
        if (balance != job.amount()) {
            throw new MarketplaceException(MarketplaceErrorCode.ESCROW_MISMATCH,
                Amounts.format(balance), Amounts.format(job.amount()));
        }
    }

    /**
     * 지급 권한 토큰 발급.
     *
     * <p>호출 전에 호출자/역할/작업 완료/미지급 검사가 끝나 있어야 합니다.</p>
     *
     * @param job 잡 포스트
     * @return 서명된 1회용 토큰
     */
    public ReleaseAuthorization authorizeRelease(JobPost job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        EscrowAccount escrow = escrowOf(job);
        String id = UUID.randomUUID().toString();
        byte[] signature = sign(id, job.address(), escrow.address(), escrow.nonce(), job.amount());
        return new ReleaseAuthorization(id, job.address(), escrow.address(), escrow.nonce(), job.amount(), signature);
    }

    /**
     * 에스크로 전액을 수령인에게 지급.
     *
     * <p>이체가 끝난 에스크로는 {@link #close(JobPost)}로 종료합니다.</p>
     *
     * @param authorization {@link #authorizeRelease}가 발급한 토큰
     * @param job 잡 포스트
     * @param recipient 수령인 (승인된 지원자)
     * @return 지급 금액
     * @throws IllegalStateException 토큰이 위조되었거나, 다른 잡에 묶여 있거나, 이미 사용된 경우
     * @throws MarketplaceException 에스크로 잔액 불일치 시 (ESCROW_MISMATCH)
     */
    public long release(ReleaseAuthorization authorization, JobPost job, AccountAddress recipient) {
        if (authorization == null || job == null || recipient == null) {
            throw new IllegalArgumentException("authorization, job and recipient cannot be null");
        }
        verify(authorization, job);
        requireFullyFunded(job);

        if (!authorization.markUsed()) {
            throw new IllegalStateException("Release authorization already used: " + authorization.getId());
        }

        AccountAddress escrow = authorization.getEscrow();
        ledger.transfer(escrow, recipient, job.amount());
        log.info("Escrow {} released {} to {}", escrow, Amounts.format(job.amount()), recipient);
        return job.amount();
    }

    /**
     * {@link #release}로 비워진 에스크로 계정 종료.
     *
     * @param job 잡 포스트
     * @throws IllegalStateException 에스크로에 잔액이 남아 있는 경우
     */
    public void close(JobPost job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        AccountAddress escrow = escrowOf(job).address();
        ledger.close(escrow);
        log.debug("Closed escrow {}", escrow);
    }

    private void verify(ReleaseAuthorization authorization, JobPost job) {
        byte[] expected = sign(authorization.getId(), authorization.getJobPost(), authorization.getEscrow(),
            authorization.getNonce(), authorization.getAmount());
        if (!MessageDigest.isEqual(expected, authorization.signature())) {
            log.warn("Rejected release authorization {} with invalid signature", authorization.getId());
            throw new IllegalStateException("Release authorization signature is invalid");
        }
        EscrowAccount escrow = escrowOf(job);
        if (!authorization.getJobPost().equals(job.address())
            || !authorization.getEscrow().equals(escrow.address())
            || authorization.getAmount() != job.amount()) {
            log.warn("Rejected release authorization {} bound to another escrow", authorization.getId());
            throw new IllegalStateException("Release authorization is not bound to job " + job.address());
        }
    }

    private byte[] sign(String id, AccountAddress jobPost, AccountAddress escrow, int nonce, long amount) {
        String payload = id + '|' + jobPost.getValue() + '|' + escrow.getValue() + '|' + nonce + '|' + amount;
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(MAC_ALGORITHM + " signing failed", e);
        }
    }
}
