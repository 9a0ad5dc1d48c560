package com.ryuqq.jobescrow.application.instruction;

import com.ryuqq.jobescrow.application.marketplace.Marketplace;
import com.ryuqq.jobescrow.application.marketplace.Payout;
import com.ryuqq.jobescrow.application.marketplace.PostJobRequest;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.Amounts;
import com.ryuqq.jobescrow.core.outcome.Fail;
import com.ryuqq.jobescrow.core.outcome.Ok;
import com.ryuqq.jobescrow.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 명령 처리기.
 *
 * <p>명령을 {@link Marketplace} 연산으로 전달하고, 결과를 {@link Outcome}으로 반환합니다.</p>
 *
 * <ul>
 *   <li>성공: {@link Ok} (생성되거나 변경된 레코드 주소 + 메시지)</li>
 *   <li>{@link MarketplaceException}: {@link Fail} (오류 코드 + 분류 + 메시지), 상태 변경 없음</li>
 *   <li>그 외 예외 (저장소 계약 위반 등): 호출자에게 그대로 전파</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class InstructionProcessor {

    private static final Logger log = LoggerFactory.getLogger(InstructionProcessor.class);

    private final Marketplace marketplace;

    /**
     * 생성자.
     *
     * @param marketplace 마켓플레이스
     * @throws IllegalArgumentException marketplace가 null인 경우
     */
    public InstructionProcessor(Marketplace marketplace) {
        if (marketplace == null) {
            throw new IllegalArgumentException("marketplace cannot be null");
        }
        this.marketplace = marketplace;
    }

    /**
     * 명령 처리.
     *
     * @param signer 서명자 신원
     * @param instruction 명령
     * @return 처리 결과
     * @throws IllegalArgumentException signer 또는 instruction이 null인 경우
     */
    public Outcome process(AccountAddress signer, Instruction instruction) {
        if (signer == null) {
            throw new IllegalArgumentException("signer cannot be null");
        }
        if (instruction == null) {
            throw new IllegalArgumentException("instruction cannot be null");
        }

        try {
            Ok ok = dispatch(signer, instruction);
            log.debug("Instruction {} by {} succeeded: {}", instruction.type(), signer, ok.account());
            return ok;
        } catch (MarketplaceException e) {
            log.warn("Instruction {} by {} rejected: [{}] {}",
                instruction.type(), signer, e.getErrorCode().getCode(), e.getMessage());
            return Fail.from(e);
        }
    }

    private Ok dispatch(AccountAddress signer, Instruction instruction) {
        if (instruction instanceof Instruction.RegisterUser register) {
            return new Ok(marketplace.registerUser(signer, register.name(), register.role()).address(),
                "User registered as " + register.role());
        }
        if (instruction instanceof Instruction.PostJob post) {
            PostJobRequest request = new PostJobRequest(
                post.title(), post.description(), post.amount(), post.startDate(), post.endDate());
            return new Ok(marketplace.postJob(signer, request).address(),
                "Job post created with amount: " + Amounts.format(post.amount()));
        }
        if (instruction instanceof Instruction.ApplyToJob apply) {
            return new Ok(marketplace.applyToJob(signer, apply.jobPost(), apply.resumeLink(), apply.expectedEndDate())
                .address(), "Application submitted");
        }
        if (instruction instanceof Instruction.ApproveApplication approve) {
            return new Ok(marketplace.approveApplication(signer, approve.jobPost(), approve.application()).address(),
                "Application approved");
        }
        if (instruction instanceof Instruction.SubmitWork submit) {
            return new Ok(marketplace.submitWork(signer, submit.application(), submit.submissionLink(),
                submit.narration()).address(), "Work submitted");
        }
        if (instruction instanceof Instruction.ApproveSubmission approve) {
            Payout payout = marketplace.approveSubmission(
                signer, approve.jobPost(), approve.application(), approve.clientReview());
            return new Ok(payout.application().address(),
                "Submission approved, " + Amounts.format(payout.amount()) + " transferred to " + payout.freelancer().getValue());
        }
        throw new IllegalArgumentException("Unsupported instruction: " + instruction.type());
    }
}
