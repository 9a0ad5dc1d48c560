package com.ryuqq.jobescrow.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ApplicationTransition 테스트.
 *
 * <p>허용 전이: PENDING → APPROVED → WORK_SUBMITTED (→ WORK_SUBMITTED) → PAID</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
class ApplicationTransitionTest {

    @ParameterizedTest
    @CsvSource({
        "PENDING, APPROVED",
        "APPROVED, WORK_SUBMITTED",
        "WORK_SUBMITTED, WORK_SUBMITTED",
        "WORK_SUBMITTED, PAID"
    })
    void isAllowed_ValidTransition_ReturnsTrue(ApplicationState from, ApplicationState to) {
        // When & Then
        assertTrue(ApplicationTransition.isAllowed(from, to));
        assertDoesNotThrow(() -> ApplicationTransition.validate(from, to));
    }

    @ParameterizedTest
    @CsvSource({
        "PENDING, WORK_SUBMITTED",
        "PENDING, PAID",
        "APPROVED, APPROVED",
        "APPROVED, PAID",
        "WORK_SUBMITTED, APPROVED",
        "PAID, WORK_SUBMITTED",
        "PAID, PAID"
    })
    void isAllowed_InvalidTransition_ReturnsFalse(ApplicationState from, ApplicationState to) {
        // When & Then
        assertFalse(ApplicationTransition.isAllowed(from, to));
        assertThrows(IllegalStateException.class, () -> ApplicationTransition.validate(from, to));
    }

    @Test
    void validate_FromTerminal_MessageMentionsTerminal() {
        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> ApplicationTransition.validate(ApplicationState.PAID, ApplicationState.PAID));

        // Then
        assertTrue(exception.getMessage().contains("terminal"));
    }

    @Test
    void isAllowed_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> ApplicationTransition.isAllowed(null, ApplicationState.APPROVED));
        assertThrows(IllegalArgumentException.class,
            () -> ApplicationTransition.isAllowed(ApplicationState.PENDING, null));
    }

    @Test
    void constructor_ThrowsUnsupportedOperationException() throws Exception {
        // Given
        Constructor<ApplicationTransition> constructor = ApplicationTransition.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        // When
        InvocationTargetException exception = assertThrows(InvocationTargetException.class, constructor::newInstance);

        // Then
        assertInstanceOf(UnsupportedOperationException.class, exception.getCause());
    }
}
