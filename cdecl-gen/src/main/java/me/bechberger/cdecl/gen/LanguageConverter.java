package me.bechberger.cdecl.gen;

import me.bechberger.cdecl.config.Language;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Accepts {@code c}, {@code c++} and {@code cxx} for the language option
 */
public class LanguageConverter implements ITypeConverter<Language> {
    @Override
    public Language convert(String value) {
        try {
            return Language.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage() + ", expected one of c, c++");
        }
    }
}
