/**
 * Core Locus library: the {@link works.locus.ServiceLocator} contract,
 * the {@link works.locus.Locator} that implements it,
 * and an in-memory {@link works.locus.MapServiceRegistry}.
 * <p>
 * Type descriptors come from {@code works.locus.types}, which this module re-exports.
 */
module works.locus.core {
	requires transitive org.jetbrains.annotations;
	requires org.pcollections;
	requires org.slf4j;
	requires transitive works.locus.types;

	requires static lombok;

	exports works.locus;
	exports works.locus.exceptions;
	exports works.locus.logging to works.locus.logback;
}
