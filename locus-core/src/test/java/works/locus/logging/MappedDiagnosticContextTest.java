package works.locus.logging;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import works.locus.types.DataType;
import works.locus.types.TypeReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static works.locus.logging.MdcKeys.LOCATOR_INSTANCE_ID;
import static works.locus.logging.MdcKeys.LOCATOR_NAME;
import static works.locus.logging.MdcKeys.REQUESTED_TYPE;

class MappedDiagnosticContextTest {

	@AfterEach
	void clearMdc() {
		MDC.clear();
	}

	@Test
	void nestedScopes_restoreOuterValues() {
		DataType strings = DataType.of(new TypeReference<List<String>>() { });
		try (var __ = MappedDiagnosticContext.setupMDC("outer", "1", strings)) {
			assertEquals("outer", MDC.get(LOCATOR_NAME));
			assertEquals("List<String>", MDC.get(REQUESTED_TYPE));
			try (var ___ = MappedDiagnosticContext.setupMDC("inner", "2", DataType.of(Integer.class))) {
				assertEquals("inner", MDC.get(LOCATOR_NAME));
				assertEquals("2", MDC.get(LOCATOR_INSTANCE_ID));
				assertEquals("Integer", MDC.get(REQUESTED_TYPE));
			}
			assertEquals("outer", MDC.get(LOCATOR_NAME));
			assertEquals("1", MDC.get(LOCATOR_INSTANCE_ID));
			assertEquals("List<String>", MDC.get(REQUESTED_TYPE));
		}
		assertNull(MDC.get(LOCATOR_NAME));
		assertNull(MDC.get(LOCATOR_INSTANCE_ID));
		assertNull(MDC.get(REQUESTED_TYPE));
	}

	@Test
	void unrelatedKeys_untouched() {
		MDC.put("request", "abc");
		try (var __ = MappedDiagnosticContext.setupMDC("locator", "1", DataType.STRING)) {
			assertEquals("abc", MDC.get("request"));
		}
		assertEquals("abc", MDC.get("request"));
	}
}
