package com.chicu.cellfeatures.features;

/**
 * Сбой вычисления признаков на прогоне, прошедшем валидацию
 * (например, неизвестный тип RPT-цикла). Не путать с «не прошёл валидацию»:
 * тот случай возвращается как пустой результат.
 */
public class FeaturizationException extends RuntimeException {

    public FeaturizationException(String message) {
        super(message);
    }

    public FeaturizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
