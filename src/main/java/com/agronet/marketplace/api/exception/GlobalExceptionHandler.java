package com.agronet.marketplace.api.exception;

import com.agronet.marketplace.api.dto.ErrorResponse;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.ForbiddenOperationException;
import com.agronet.marketplace.exception.InvalidTransitionException;
import com.agronet.marketplace.exception.QuantityExceededException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the marketplace API.
 * Maps the lifecycle error taxonomy onto HTTP statuses with a uniform {@link ErrorResponse} body.
 *
 * @author Agronet Marketplace Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle ValidationException.
     * Returns 400 BAD REQUEST for field rule violations.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            ValidationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation error: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(),
                request.getRequestURI());
        error.addDetail("field", ex.getField());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle InvalidTransitionException.
     * Returns 409 CONFLICT with the current status and the statuses that would be allowed.
     */
    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransitionException(
            InvalidTransitionException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid transition: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage(),
                request.getRequestURI());
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("currentStatus", ex.getCurrentStatus());
        error.addDetail("targetStatus", ex.getTargetStatus());
        error.addDetail("allowedStatuses", ex.getAllowedStatuses());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle QuantityExceededException.
     * Returns 409 CONFLICT when a request asks for more than is available.
     */
    @ExceptionHandler(QuantityExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuantityExceededException(
            QuantityExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Quantity exceeded: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Quantity Exceeded", ex.getMessage(),
                request.getRequestURI());
        error.addDetail("announcementId", ex.getAnnouncementId());
        error.addDetail("requestedQuantity", ex.getRequestedQuantity());
        error.addDetail("availableQuantity", ex.getAvailableQuantity());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflictException(
            ConflictException ex,
            HttpServletRequest request
    ) {
        logger.warn("Conflict: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Conflict", ex.getMessage(),
                request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle concurrent modification detected through the version column.
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(
            ObjectOptimisticLockingFailureException ex,
            HttpServletRequest request
    ) {
        logger.warn("Optimistic lock failure on {}: {}", ex.getPersistentClassName(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Conflict",
                "The resource was modified concurrently. Please reload and try again.",
                request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(
            DataIntegrityViolationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Conflict",
                "The request conflicts with existing data.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<ErrorResponse> handleForbiddenOperationException(
            ForbiddenOperationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Forbidden: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(),
                request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle AccessDeniedException from method security.
     * Returns 401 when the caller is anonymous, 403 otherwise.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = SecurityUtils.getCurrentUserId() == null ? HttpStatus.UNAUTHORIZED : HttpStatus.FORBIDDEN;
        logger.warn("Access denied ({}): {}", status.value(), ex.getMessage());

        ErrorResponse error = new ErrorResponse(status,
                status == HttpStatus.UNAUTHORIZED ? "Unauthorized" : "Forbidden",
                status == HttpStatus.UNAUTHORIZED ? "Authentication is required" : "Access denied",
                request.getRequestURI());
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when any resource doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.NOT_FOUND, "Resource Not Found", ex.getMessage(),
                request.getRequestURI());
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed. Please check the field errors.", request.getRequestURI());
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Unreadable JSON, including unknown enum values.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Malformed Request",
                "Request body is malformed or contains invalid values.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ErrorResponse> handleBadParameter(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Bad request parameter: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage(),
                request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(
            MaxUploadSizeExceededException ex,
            HttpServletRequest request
    ) {
        logger.warn("Upload too large: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.PAYLOAD_TOO_LARGE, "Payload Too Large",
                "Uploaded files exceed the maximum allowed size.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
