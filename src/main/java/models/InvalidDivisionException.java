package models;

/**
 * Aruncată când un attachee este creat cu o divizie care nu face parte din cele patru ale hub-ului.
 */
public class InvalidDivisionException extends IllegalArgumentException {
    public InvalidDivisionException(String message) {
        super(message);
    }
}
