package com.ryuqq.jobescrow.core.address;

import com.ryuqq.jobescrow.core.account.EscrowAccount;
import com.ryuqq.jobescrow.core.model.AccountAddress;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.function.Predicate;

/**
 * 프로그램 파생 주소 계산기.
 *
 * <p>모든 레코드 주소는 시드 목록과 programId로부터 SHA-256으로 결정적으로 파생됩니다.
 * 같은 입력은 항상 같은 주소를 만들기 때문에, 호출자는 조회 없이도 자신이 넘길
 * 참조를 계산할 수 있고, 저장소는 파생 주소를 키로 중복을 막을 수 있습니다.</p>
 *
 * <p><strong>시드 규칙:</strong></p>
 * <ul>
 *   <li>사용자 계정: ("user", owner)</li>
 *   <li>잡 포스트: ("job_post", client, title)</li>
 *   <li>지원서: ("application", jobPost, applicant)</li>
 *   <li>에스크로: ("escrow", jobPost, nonce)</li>
 * </ul>
 *
 * <p><strong>Nonce 탐색:</strong> 에스크로 주소는 nonce 255부터 0까지 내려가며
 * 아직 사용되지 않은 첫 주소를 선택합니다 (정규 nonce). 선택된 nonce는 잡 포스트에
 * 저장되어, 지급 시 같은 주소를 다시 파생해 권한을 검증하는 데 사용됩니다.</p>
 *
 * <p>Thread-safe: 상태 없음 (programId만 보유).</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class ProgramAddresses {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final byte[] DERIVATION_MARKER = "ProgramDerivedAddress".getBytes(StandardCharsets.UTF_8);
    private static final int MAX_NONCE = 255;

    private final byte[] programId;

    /**
     * 생성자.
     *
     * @param programId 파생 주소 네임스페이스
     * @throws IllegalArgumentException programId가 null이거나 빈 문자열인 경우
     */
    public ProgramAddresses(String programId) {
        if (programId == null || programId.isBlank()) {
            throw new IllegalArgumentException("programId cannot be null or blank");
        }
        this.programId = programId.getBytes(StandardCharsets.UTF_8);
    }

    public AccountAddress userAccount(AccountAddress owner) {
        requireNonNull(owner, "owner");
        return derive(seed("user"), seed(owner));
    }

    public AccountAddress jobPost(AccountAddress client, String title) {
        requireNonNull(client, "client");
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        return derive(seed("job_post"), seed(client), seed(title));
    }

    public AccountAddress application(AccountAddress jobPost, AccountAddress applicant) {
        requireNonNull(jobPost, "jobPost");
        requireNonNull(applicant, "applicant");
        return derive(seed("application"), seed(jobPost), seed(applicant));
    }

    /**
     * 저장된 nonce로 에스크로 주소 재파생.
     *
     * @param jobPost 잡 포스트 주소
     * @param nonce 파생 nonce
     * @return 에스크로 주소
     * @throws IllegalArgumentException jobPost가 null이거나 nonce가 범위를 벗어난 경우
     */
    public AccountAddress escrow(AccountAddress jobPost, int nonce) {
        requireNonNull(jobPost, "jobPost");
        if (nonce < 0 || nonce > MAX_NONCE) {
            throw new IllegalArgumentException("nonce must be between 0 and " + MAX_NONCE + ": " + nonce);
        }
        return derive(seed("escrow"), seed(jobPost), new byte[] {(byte) nonce});
    }

    /**
     * 정규 nonce 탐색으로 신규 에스크로 주소 결정.
     *
     * @param jobPost 잡 포스트 주소
     * @param unused 후보 주소가 아직 사용되지 않았는지 판단
     * @return 에스크로 레코드 (주소 + nonce)
     * @throws IllegalStateException 모든 nonce가 사용 중인 경우
     */
    public EscrowAccount findEscrow(AccountAddress jobPost, Predicate<AccountAddress> unused) {
        requireNonNull(jobPost, "jobPost");
        if (unused == null) {
            throw new IllegalArgumentException("unused predicate cannot be null");
        }
        for (int nonce = MAX_NONCE; nonce >= 0; nonce--) {
            AccountAddress candidate = escrow(jobPost, nonce);
            if (unused.test(candidate)) {
                return new EscrowAccount(candidate, jobPost, nonce);
            }
        }
        throw new IllegalStateException("No unused escrow address for jobPost: " + jobPost);
    }

    private AccountAddress derive(byte[]... seeds) {
        MessageDigest digest = newDigest();
        for (byte[] seed : seeds) {
            // 길이 접두사로 ("ab","c")와 ("a","bc")를 구분
            digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(seed.length).array());
            digest.update(seed);
        }
        digest.update(programId);
        digest.update(DERIVATION_MARKER);
        return AccountAddress.of(toHex(digest.digest()));
    }

    private static byte[] seed(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] seed(AccountAddress address) {
        return seed(address.getValue());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder builder = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            builder.append(Character.forDigit((b >> 4) & 0xF, 16));
            builder.append(Character.forDigit(b & 0xF, 16));
        }
        return builder.toString();
    }

    private static void requireNonNull(AccountAddress address, String name) {
        if (address == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
