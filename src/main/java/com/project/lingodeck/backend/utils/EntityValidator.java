package com.project.lingodeck.backend.utils;

import com.project.lingodeck.backend.exception.ExceptionMessage;
import com.project.lingodeck.backend.exception.InvalidArgumentException;
import com.project.lingodeck.backend.exception.ValidationFailureException;
import org.springframework.stereotype.Component;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindingResult;
import org.springframework.validation.beanvalidation.SpringValidatorAdapter;

/**
 * Runs Bean Validation on objects that do not arrive through a controller,
 * e.g. card content built from a request or handed over by the card generator.
 */
@Component
public class EntityValidator {
    private final SpringValidatorAdapter validator;
    EntityValidator(jakarta.validation.Validator validator) {
        this.validator = new SpringValidatorAdapter(validator);
    }

    public void validate(Object object){
        if(object == null) {
            throw new InvalidArgumentException(ExceptionMessage.VALIDATION_FAILED + ": nothing to validate");
        }
        BindingResult bindingResult = new BeanPropertyBindingResult(object, object.getClass().getSimpleName());
        validator.validate(object, bindingResult);
        if(bindingResult.hasErrors()) {
            throw new ValidationFailureException(ExceptionMessage.VALIDATION_FAILED, bindingResult);
        }
    }
}
