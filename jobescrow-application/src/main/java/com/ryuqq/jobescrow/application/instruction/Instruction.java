package com.ryuqq.jobescrow.application.instruction;

import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.UserRole;

/**
 * 서명자 한 명이 제출하는 마켓플레이스 명령.
 *
 * <p>각 명령은 {@link com.ryuqq.jobescrow.application.marketplace.Marketplace}의
 * 변경 연산 하나에 대응하며, {@link InstructionProcessor}가 결과를
 * {@link com.ryuqq.jobescrow.core.outcome.Outcome}으로 변환합니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public sealed interface Instruction
    permits Instruction.RegisterUser, Instruction.PostJob, Instruction.ApplyToJob,
    Instruction.ApproveApplication, Instruction.SubmitWork, Instruction.ApproveSubmission {

    /**
     * 로그와 결과 메시지에 쓰이는 명령 이름.
     *
     * @return 명령 이름 (예: "PostJob")
     */
    default String type() {
        return getClass().getSimpleName();
    }

    record RegisterUser(String name, UserRole role) implements Instruction {
    }

    record PostJob(String title, String description, long amount, Long startDate, Long endDate) implements Instruction {
    }

    record ApplyToJob(AccountAddress jobPost, String resumeLink, Long expectedEndDate) implements Instruction {
    }

    record ApproveApplication(AccountAddress jobPost, AccountAddress application) implements Instruction {
    }

    record SubmitWork(AccountAddress application, String submissionLink, String narration) implements Instruction {
    }

    record ApproveSubmission(AccountAddress jobPost, AccountAddress application, String clientReview)
        implements Instruction {
    }
}
