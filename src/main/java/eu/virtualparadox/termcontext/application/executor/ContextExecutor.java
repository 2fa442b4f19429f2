package eu.virtualparadox.termcontext.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool running one resolution task per query term.
 */
public class ContextExecutor extends ThreadPoolTaskExecutor {
}
