/**
 * Logback-specific logging utilities.
 */
module works.locus.logback {
	requires transitive ch.qos.logback.classic;
	requires transitive ch.qos.logback.core;
	requires transitive org.slf4j;
	requires transitive works.locus.core;

	exports works.locus.logback;
}
