package com.ryuqq.jobescrow.core.custody;

import com.ryuqq.jobescrow.core.model.AccountAddress;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 에스크로 지급 권한 토큰.
 *
 * <p>{@link EscrowCustodian#authorizeRelease}만 발급할 수 있으며 (생성자 package-private),
 * 커스터디언이 보유한 내부 키로 서명됩니다. 호출자의 서명이 아니라 이 토큰이
 * 에스크로 지급을 허가하는 유일한 수단이며, 한 번만 사용할 수 있습니다.</p>
 *
 * <p>사용 여부는 토큰 인스턴스가 직접 보관합니다. 외부에서는 같은 서명을 가진
 * 사본을 만들 수 없으므로, 커스터디언은 소비된 토큰 목록을 유지하지 않습니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class ReleaseAuthorization {

    private final String id;
    private final AccountAddress jobPost;
    private final AccountAddress escrow;
    private final int nonce;
    private final long amount;
    private final byte[] signature;
    private final AtomicBoolean used = new AtomicBoolean(false);

    ReleaseAuthorization(String id, AccountAddress jobPost, AccountAddress escrow,
                         int nonce, long amount, byte[] signature) {
        this.id = id;
        this.jobPost = jobPost;
        this.escrow = escrow;
        this.nonce = nonce;
        this.amount = amount;
        this.signature = signature.clone();
    }

    public String getId() {
        return id;
    }

    public AccountAddress getJobPost() {
        return jobPost;
    }

    public AccountAddress getEscrow() {
        return escrow;
    }

    public int getNonce() {
        return nonce;
    }

    public long getAmount() {
        return amount;
    }

    byte[] signature() {
        return signature.clone();
    }

    /**
     * 토큰을 사용 상태로 전환.
     *
     * @return 처음 사용이면 true, 이미 사용된 토큰이면 false
     */
    boolean markUsed() {
        return used.compareAndSet(false, true);
    }

    public boolean isUsed() {
        return used.get();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReleaseAuthorization that = (ReleaseAuthorization) o;
        return id.equals(that.id) && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ReleaseAuthorization{id=" + id + ", jobPost=" + jobPost + ", amount=" + amount + '}';
    }
}
