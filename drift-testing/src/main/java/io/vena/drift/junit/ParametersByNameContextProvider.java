package io.vena.drift.junit;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.extension.Extension;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.TestTemplateInvocationContext;
import org.junit.jupiter.api.extension.TestTemplateInvocationContextProvider;
import org.junit.platform.commons.util.ReflectionUtils;

import static java.util.Collections.singletonList;
import static java.util.stream.Collectors.toList;

public class ParametersByNameContextProvider implements TestTemplateInvocationContextProvider {

	@Override
	public boolean supportsTestTemplate(ExtensionContext context) {
		return context.getTestMethod().isPresent();
	}

	@Override
	public Stream<TestTemplateInvocationContext> provideTestTemplateInvocationContexts(ExtensionContext context) {
		Class<?> testClass = context.getRequiredTestClass();
		Map<String, List<?>> valuesByName = new LinkedHashMap<>();
		for (String name: parameterNames(context)) {
			valuesByName.put(name, valuesFor(name, testClass));
		}
		List<Map<String, ?>> bindings = combinations(valuesByName);

		int singleInvocationIndex = context.getTestMethod()
			.map(m -> m.getAnnotation(ParametersByName.class))
			.map(ParametersByName::singleInvocationIndex)
			.orElse(0);
		if (singleInvocationIndex == 0) {
			return bindings.stream().map(binding -> invocationContext(binding, null));
		} else if (singleInvocationIndex <= bindings.size()) {
			return Stream.of(invocationContext(bindings.get(singleInvocationIndex - 1), singleInvocationIndex));
		} else {
			throw new ParameterResolutionException("Invalid invocation index " + singleInvocationIndex + "; there are only " + bindings.size());
		}
	}

	private static TestTemplateInvocationContext invocationContext(Map<String, ?> binding, Integer fixedIndex) {
		return new TestTemplateInvocationContext() {
			@Override
			public String getDisplayName(int invocationIndex) {
				int index = (fixedIndex == null) ? invocationIndex : fixedIndex;
				return "[" + index + "] " + binding;
			}

			@Override
			public List<Extension> getAdditionalExtensions() {
				return singletonList(new ParameterBinder(binding));
			}
		};
	}

	private static List<String> parameterNames(ExtensionContext context) {
		List<Parameter> parameters = new ArrayList<>();

		Class<?> testClass = context.getRequiredTestClass();
		List<Constructor<?>> annotatedConstructors = ReflectionUtils.findConstructors(testClass, c -> c.isAnnotationPresent(ParametersByName.class));
		if (annotatedConstructors.size() > 1) {
			throw new ParameterResolutionException("Multiple constructors annotated with " + ParametersByName.class.getSimpleName() + ": " + annotatedConstructors);
		} else if (annotatedConstructors.size() == 1) {
			Collections.addAll(parameters, annotatedConstructors.get(0).getParameters());
		}
		Collections.addAll(parameters, context.getRequiredTestMethod().getParameters());

		List<String> result = parameters.stream()
			.map(Parameter::getName)
			.distinct()
			.collect(toList());
		for (String name: result) {
			if (name.matches("arg\\d+")) {
				throw new ParameterResolutionException("Parameter names are unavailable; compile with -parameters");
			}
		}
		return result;
	}

	private static List<?> valuesFor(String name, Class<?> testClass) {
		Method method = ReflectionUtils.getRequiredMethod(testClass, name);
		Object values = ReflectionUtils.invokeMethod(method, null);
		if (values instanceof Stream) {
			return ((Stream<?>) values).collect(toList());
		} else if (values instanceof Iterable) {
			return StreamSupport.stream(((Iterable<?>) values).spliterator(), false).collect(toList());
		} else {
			throw new ParameterResolutionException("Method " + name + " must return a Stream or Iterable; got " + values);
		}
	}

	private static List<Map<String, ?>> combinations(Map<String, List<?>> valuesByName) {
		List<Map<String, ?>> result = singletonList(Collections.emptyMap());
		for (Map.Entry<String, List<?>> entry: valuesByName.entrySet()) {
			List<Map<String, ?>> extended = new ArrayList<>();
			for (Map<String, ?> existing: result) {
				for (Object value: entry.getValue()) {
					Map<String, Object> binding = new LinkedHashMap<>(existing);
					binding.put(entry.getKey(), value);
					extended.add(binding);
				}
			}
			result = extended;
		}
		return result;
	}

	private static final class ParameterBinder implements ParameterResolver {
		private final Map<String, ?> binding;

		ParameterBinder(Map<String, ?> binding) {
			this.binding = binding;
		}

		@Override
		public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) throws ParameterResolutionException {
			return binding.containsKey(parameterContext.getParameter().getName());
		}

		@Override
		public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) throws ParameterResolutionException {
			return binding.get(parameterContext.getParameter().getName());
		}
	}
}
