package org.proxml;

/**
 * <p>
 * A sealable item is one that can be modified until the {@link #seal()} method is called. After this method is called, the item becomes
 * immutable and any attempt to modify it will result in a {@link SealedException} being thrown.
 * </p>
 * <p>
 * Items built incrementally from a stream of events typically remain unsealed while the events affecting them may still arrive, and are
 * sealed as soon as the last such event has been handled.
 * </p>
 */
public interface Sealable {
	/** The type of exception that is thrown when an attempt is made to modify a sealed object */
	public static class SealedException extends RuntimeException {
		private final Sealable theItem;

		/**
		 * A shortcut constructor that generates a simple message describing the error
		 *
		 * @param item The item that has been sealed
		 */
		public SealedException(Sealable item) {
			super("Sealable item " + item + " (type " + item.getClass().getName() + ") has been sealed and cannot be modified");
			theItem = item;
		}

		/** @return The sealed item that an attempt was made to modify */
		public Sealable getItem() {
			return theItem;
		}
	}

	/** @return Whether this item has been sealed */
	boolean isSealed();

	/** Seals this item, causing it to become immutable. This cannot be undone. */
	void seal();
}
