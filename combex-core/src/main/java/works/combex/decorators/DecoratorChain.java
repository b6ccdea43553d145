package works.combex.decorators;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.combex.attributes.CleanAttributes;
import works.combex.event.Event;

/**
 * Applies {@link Decorator}s in order. A decorator that throws or returns null
 * is skipped for that event, with a warning.
 */
public final class DecoratorChain {
	private final List<Decorator> decorators;

	public DecoratorChain(List<Decorator> decorators) {
		this.decorators = List.copyOf(decorators);
	}

	public List<Event> apply(List<Event> events) {
		if (decorators.isEmpty()) {
			return events;
		}
		return events.stream()
			.map(this::applyAll)
			.toList();
	}

	private Event applyAll(Event event) {
		CleanAttributes data = event.data();
		for (Decorator d: decorators) {
			CleanAttributes decorated;
			try {
				decorated = d.decorate(data);
			} catch (RuntimeException e) {
				LOGGER.warn("Decorator {} threw; skipping it", d.getClass().getName(), e);
				continue;
			}
			if (decorated == null) {
				LOGGER.warn("Decorator {} returned null; skipping it", d.getClass().getName());
			} else {
				data = decorated;
			}
		}
		return event.withData(data);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DecoratorChain.class);
}
