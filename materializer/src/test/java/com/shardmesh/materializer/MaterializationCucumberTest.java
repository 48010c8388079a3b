package com.shardmesh.materializer;

import org.junit.platform.suite.api.ConfigurationParameter;
import org.junit.platform.suite.api.IncludeEngines;
import org.junit.platform.suite.api.SelectClasspathResource;
import org.junit.platform.suite.api.Suite;

import static io.cucumber.junit.platform.engine.Constants.GLUE_PROPERTY_NAME;
import static io.cucumber.junit.platform.engine.Constants.PLUGIN_PROPERTY_NAME;

/**
 * End-to-end scenarios: schema authoring, field transformation and batch materialization against the
 * in-memory repositories.
 */
@Suite
@IncludeEngines("cucumber")
@SelectClasspathResource("features/materialization")
@ConfigurationParameter(key = GLUE_PROPERTY_NAME, value = "com.shardmesh.materializer.steps")
@ConfigurationParameter(key = PLUGIN_PROPERTY_NAME, value = "pretty, json:target/cucumber-reports/materialization.json")
public class MaterializationCucumberTest {
}
