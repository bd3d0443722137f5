package com.example.file_registry.util;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/** Accepts only names that {@link FilenameSanitizer} would leave unchanged. */
public class FilenameValidator implements ConstraintValidator<ValidFilename, String> {

  @Override
  public boolean isValid(String value, ConstraintValidatorContext context) {
    if (value == null || value.isBlank()) {
      return false;
    }
    return FilenameSanitizer.sanitize(value).equals(value);
  }
}
