package org.modelform.ast;

import java.io.IOException;
import java.util.List;

import com.google.common.collect.ImmutableList;

/** A {@link TypeResolver} that asks each of a sequence of resolvers in turn; the first to find a type wins */
public class CompositeTypeResolver implements TypeResolver {
	private final List<TypeResolver> theResolvers;

	/** @param resolvers The resolvers to consult, in order */
	public CompositeTypeResolver(List<? extends TypeResolver> resolvers) {
		theResolvers = ImmutableList.copyOf(resolvers);
	}

	/** @param resolvers The resolvers to consult, in order */
	public CompositeTypeResolver(TypeResolver... resolvers) {
		this(ImmutableList.copyOf(resolvers));
	}

	@Override
	public RawFragment resolve(String typeReference) throws IOException {
		for (TypeResolver resolver : theResolvers) {
			RawFragment found = resolver.resolve(typeReference);
			if (found != null)
				return found;
		}
		return null;
	}
}
