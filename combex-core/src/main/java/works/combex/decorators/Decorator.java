package works.combex.decorators;

import works.combex.attributes.CleanAttributes;

/**
 * Adds to, or otherwise adjusts, an event's data before delivery.
 */
public interface Decorator {
	CleanAttributes decorate(CleanAttributes data);
}
