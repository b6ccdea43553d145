package works.combex.decorators;

import works.combex.attributes.CleanAttributes;

/**
 * Adds a fixed set of fields to every event.
 * Fields the event already has are left alone.
 */
public record StaticFieldsDecorator(CleanAttributes fields) implements Decorator {
	@Override
	public CleanAttributes decorate(CleanAttributes data) {
		return data.merge(fields);
	}
}
