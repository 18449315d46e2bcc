package acme.model;

public record Subproblem(
    String type,
    String detail,
    Identifier identifier
) {

}
