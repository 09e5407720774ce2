package com.foreman.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setPhase and setTask populate MDC keys")
    void setKeys() {
        MdcContext.setPhase("implement");
        MdcContext.setTask("auth.login");

        assertEquals("implement", MDC.get("sessionPhase"));
        assertEquals("auth.login", MDC.get("taskId"));
    }

    @Test
    @DisplayName("clearTask keeps the phase")
    void clearTask() {
        MdcContext.setPhase("heal");
        MdcContext.setTask("auth.login");
        MdcContext.clearTask();

        assertNull(MDC.get("taskId"));
        assertEquals("heal", MDC.get("sessionPhase"));
    }

    @Test
    @DisplayName("clear removes both keys")
    void clear() {
        MdcContext.setPhase("deliver");
        MdcContext.setTask("ui.nav");
        MdcContext.clear();

        assertNull(MDC.get("sessionPhase"));
        assertNull(MDC.get("taskId"));
    }
}
