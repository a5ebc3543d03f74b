package com.chicu.cellfeatures.dataset.params;

import java.util.Map;
import java.util.Optional;

/**
 * Параметры протокола испытания по метке прогона (колонка → значение).
 */
@FunctionalInterface
public interface ProtocolParameterStore {

    Optional<Map<String, String>> lookup(String runLabel);
}
