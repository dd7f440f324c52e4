package com.flamingo.ai.librarychat.service.generation;

/** Model identifier and sampling temperature for one generation call. */
public record ModelSettings(String modelName, double temperature) {}
