package org.javai.backoff.observe;

/**
 * The lifecycle points at which observers are notified.
 */
public enum RetryEvent {
	/** Before each attempt. */
	TRY("try"),
	/** After a failed attempt, before sleeping. */
	BACKOFF("backoff"),
	/** When the loop stops without success. */
	GIVEUP("giveup"),
	/** After a successful attempt. */
	SUCCESS("success");

	private final String eventType;

	RetryEvent(String eventType) {
		this.eventType = eventType;
	}

	public String eventType() {
		return eventType;
	}
}
