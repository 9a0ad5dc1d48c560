package com.ryuqq.jobescrow.core.account;

import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.statemachine.ApplicationState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Application 레코드 테스트.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
class ApplicationTest {

    private static final AccountAddress JOB = AccountAddress.of("job-1");

    private final Application pending = Application.submitted(
        AccountAddress.of("application-1"), AccountAddress.of("freelancer-b"), JOB, "https://resume", 1_800_000_000L);

    @Test
    void 신규_지원서는_PENDING_이고_텍스트_필드가_비어_있음() {
        assertThat(pending.state()).isEqualTo(ApplicationState.PENDING);
        assertThat(pending.submissionLink()).isEmpty();
        assertThat(pending.narration()).isEmpty();
        assertThat(pending.clientReview()).isEmpty();
        assertThat(pending.expectedEndDate()).isEqualTo(1_800_000_000L);
    }

    @Test
    void 승인_제출_지급_순서로_전이하며_원본은_불변() {
        // when
        Application approved = pending.approve();
        Application submitted = approved.submitWork("https://work", "done");
        Application paid = submitted.settle("great");

        // then
        assertThat(pending.approved()).isFalse();
        assertThat(approved.state()).isEqualTo(ApplicationState.APPROVED);
        assertThat(submitted.state()).isEqualTo(ApplicationState.WORK_SUBMITTED);
        assertThat(paid.state()).isEqualTo(ApplicationState.PAID);
        assertThat(paid.clientReview()).isEqualTo("great");
        assertThat(paid.submissionLink()).isEqualTo("https://work");
        assertThat(paid.resumeLink()).isEqualTo("https://resume");
    }

    @Test
    void 허용되지_않은_전이는_IllegalStateException() {
        assertThatThrownBy(() -> pending.submitWork("https://work", "early")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pending.settle("early")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> pending.approve().approve()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void belongsTo는_잡_주소를_비교함() {
        assertThat(pending.belongsTo(JOB)).isTrue();
        assertThat(pending.belongsTo(AccountAddress.of("job-2"))).isFalse();
    }
}
