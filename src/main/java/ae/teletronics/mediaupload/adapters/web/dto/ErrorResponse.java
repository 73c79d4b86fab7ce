package ae.teletronics.mediaupload.adapters.web.dto;

public record ErrorResponse(String code, String message) { }
