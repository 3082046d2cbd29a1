package org.javai.tutoreval.agent;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls under a per-call time limit.
 *
 * <p>A call that exceeds the limit is cancelled and reported as an {@link AgentInvocationException} of kind
 * {@link AgentInvocationException.Kind#TIMEOUT}. Nothing is retried here.</p>
 *
 * <p>The limit is counted from the moment the call starts running on the executor, so time spent queued
 * behind other calls on a busy executor is never charged to the call.</p>
 */
public class TimeLimitedInvoker {

	private final ExecutorService executor;

	public TimeLimitedInvoker(ExecutorService executor) {
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
	}

	/**
	 * @param role role being invoked, used to label failures
	 * @param timeout per-call limit; {@code null}, zero or negative runs the call on the calling thread without a limit
	 * @param call the collaborator call
	 */
	public <T> T invoke(AgentRole role, Duration timeout, Supplier<T> call) {
		if (timeout == null || timeout.isZero() || timeout.isNegative()) {
			return callDirectly(role, call);
		}
		CountDownLatch started = new CountDownLatch(1);
		Future<T> future = executor.submit(() -> {
			started.countDown();
			return call.get();
		});
		try {
			started.await();
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			throw new AgentInvocationException(role, AgentInvocationException.Kind.TIMEOUT,
					role + " call exceeded " + timeout.toMillis() + " ms", e);
		} catch (ExecutionException e) {
			throw translate(role, e.getCause() != null ? e.getCause() : e);
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw AgentInvocationException.failure(role, role + " call interrupted", e);
		}
	}

	private <T> T callDirectly(AgentRole role, Supplier<T> call) {
		try {
			return call.get();
		} catch (RuntimeException e) {
			throw translate(role, e);
		}
	}

	private AgentInvocationException translate(AgentRole role, Throwable cause) {
		if (cause instanceof AgentInvocationException invocationException) {
			return invocationException;
		}
		String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		return AgentInvocationException.failure(role, role + " call failed: " + detail, cause);
	}
}
