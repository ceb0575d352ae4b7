package io.forgedi.common;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ApplicationSettingsTest {
	@After
	public void tearDown() {
		System.clearProperty(ApplicationSettingsTest.class.getName() + ".flag");
		System.clearProperty(ApplicationSettingsTest.class.getSimpleName() + ".flag");
		System.clearProperty(ApplicationSettingsTest.class.getSimpleName() + ".count");
	}

	@Test
	public void defaultsWhenUnset() {
		assertTrue(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "flag", true));
		assertEquals(3, ApplicationSettings.getInt(ApplicationSettingsTest.class, "count", 3));
	}

	@Test
	public void simpleNameProperty() {
		System.setProperty(ApplicationSettingsTest.class.getSimpleName() + ".count", "17");
		assertEquals(17, ApplicationSettings.getInt(ApplicationSettingsTest.class, "count", 3));
	}

	@Test
	public void fullNameTakesPrecedence() {
		System.setProperty(ApplicationSettingsTest.class.getSimpleName() + ".flag", "true");
		System.setProperty(ApplicationSettingsTest.class.getName() + ".flag", "false");
		assertFalse(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "flag", true));
	}
}
