package io.vena.drift.junit;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.TestTemplate;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Runs a test once for every combination of its parameter values.
 *
 * <p>
 * Each parameter of the annotated test method (and of the test class's constructor, if it
 * carries this annotation too) is bound by name: a static no-argument method of the same name
 * on the test class supplies its values as a {@link java.util.stream.Stream} or {@link Iterable}.
 * Requires classes compiled with {@code -parameters}.
 */
@Target({ ElementType.ANNOTATION_TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR })
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(ParametersByNameContextProvider.class)
@TestTemplate
public @interface ParametersByName {
	/**
	 * Zero runs every combination. Otherwise, runs only the combination with this
	 * index, counting from 1, as shown in the test's display name.
	 */
	int singleInvocationIndex() default 0;
}
