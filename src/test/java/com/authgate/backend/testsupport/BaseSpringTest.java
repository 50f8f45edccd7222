package com.authgate.backend.testsupport;

import org.springframework.test.context.ActiveProfiles;

/** Pins the test profile for every Spring-backed test. */
@ActiveProfiles("test")
public abstract class BaseSpringTest {
}
