package org.javai.backoff.observe;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The observers registered for each lifecycle event of a retrier.
 */
public final class Observers {

	private static final Observers NONE = new Observers(List.of(), List.of(), List.of(), List.of());

	private final Map<RetryEvent, List<RetryObserver>> observers = new EnumMap<>(RetryEvent.class);

	/**
	 * @param onTry observers called before each attempt
	 * @param onBackoff observers called before each sleep
	 * @param onGiveup observers called when the loop gives up
	 * @param onSuccess observers called on success
	 */
	public Observers(List<? extends RetryObserver> onTry,
					 List<? extends RetryObserver> onBackoff,
					 List<? extends RetryObserver> onGiveup,
					 List<? extends RetryObserver> onSuccess) {
		observers.put(RetryEvent.TRY, copy("onTry", onTry));
		observers.put(RetryEvent.BACKOFF, copy("onBackoff", onBackoff));
		observers.put(RetryEvent.GIVEUP, copy("onGiveup", onGiveup));
		observers.put(RetryEvent.SUCCESS, copy("onSuccess", onSuccess));
	}

	public static Observers none() {
		return NONE;
	}

	/**
	 * Calls every observer registered for {@code event}, in order.
	 * Observer exceptions propagate to the caller.
	 */
	public void notify(RetryEvent event, Details details) {
		for (RetryObserver observer : observers.get(event)) {
			observer.onEvent(details);
		}
	}

	public List<RetryObserver> get(RetryEvent event) {
		return observers.get(Objects.requireNonNull(event, "event must not be null"));
	}

	private static List<RetryObserver> copy(String name, List<? extends RetryObserver> list) {
		Objects.requireNonNull(list, name + " must not be null");
		for (RetryObserver observer : list) {
			Objects.requireNonNull(observer, name + " must not contain null observers");
		}
		return List.copyOf(list);
	}
}
