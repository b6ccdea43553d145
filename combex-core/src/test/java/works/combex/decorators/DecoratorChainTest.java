package works.combex.decorators;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.combex.attributes.Attribute;
import works.combex.attributes.CleanAttributes;
import works.combex.event.Event;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DecoratorChainTest {
	static final Event EVENT = new Event("2019-05-17T09:55:12.622658Z", CleanAttributes.of(Attribute.of("service_name", "from event")));

	@Test
	void staticFields_doNotOverrideExisting() {
		Decorator decorator = new StaticFieldsDecorator(CleanAttributes.of(
			Attribute.of("service_name", "from decorator"),
			Attribute.of("region", "north")));
		List<Event> actual = new DecoratorChain(List.of(decorator)).apply(List.of(EVENT));
		assertEquals(CleanAttributes.of(
			Attribute.of("region", "north"),
			Attribute.of("service_name", "from event")
		), actual.get(0).data());
	}

	@Test
	void decorators_applyInOrder() {
		Decorator first = data -> data.merge(CleanAttributes.of(Attribute.of("step", 1L)));
		Decorator second = data -> data.without("step").merge(CleanAttributes.of(Attribute.of("step", 2L)));
		List<Event> actual = new DecoratorChain(List.of(first, second)).apply(List.of(EVENT));
		assertEquals(2L, actual.get(0).data().get("step").orElseThrow().asObject());
	}

	@Test
	void misbehavingDecorators_areSkipped() {
		Decorator thrower = data -> { throw new IllegalStateException("Oops"); };
		Decorator nullReturner = data -> null;
		assertEquals(List.of(EVENT), new DecoratorChain(List.of(thrower, nullReturner)).apply(List.of(EVENT)));
	}
}
