package com.spreadsheet.calc.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches exceptions from the controllers and services and turns them into
 * error JSON. Formula failures and bad input are 4xx, only unexpected
 * exceptions are 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FormulaParseException.class)
    public ResponseEntity<ErrorResponse> handleParse(FormulaParseException ex) {
        return build("PARSE_ERROR", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(UnknownFunctionException.class)
    public ResponseEntity<ErrorResponse> handleUnknownFunction(UnknownFunctionException ex) {
        return build("UNKNOWN_FUNCTION", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ArgumentCountException.class)
    public ResponseEntity<ErrorResponse> handleArgumentCount(ArgumentCountException ex) {
        return build("ARGUMENT_COUNT", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(FormulaEvaluationException.class)
    public ResponseEntity<ErrorResponse> handleEvaluation(FormulaEvaluationException ex) {
        return build("EVALUATION_ERROR", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidReferenceException ex) {
        return build("INVALID_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CircularReferenceException.class)
    public ResponseEntity<ErrorResponse> handleCircularRef(CircularReferenceException ex) {
        return build("CIRCULAR_REFERENCE", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InvalidCellAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidCellAddressException ex) {
        return build("INVALID_ADDRESS", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return build("INVALID_REQUEST", ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex) {
        return build("WORKBOOK_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return build("SHEET_NOT_FOUND", ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        logger.error("Unhandled exception", ex);
        return build("SERVER_ERROR", ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> build(String code, RuntimeException ex, HttpStatus status) {
        logger.debug("{}: {}", code, ex.getMessage());
        ErrorResponse error = new ErrorResponse(code, ex.getMessage(), status.value());
        return new ResponseEntity<>(error, status);
    }
}
