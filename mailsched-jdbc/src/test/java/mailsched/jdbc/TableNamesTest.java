package mailsched.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("company_drive", TableNames.validate("company_drive"));
        assertEquals("Notification2", TableNames.validate("Notification2"));
    }

    @Test
    void invalidTableNamesThrow() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my-table"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("my.table"));
    }

    @Test
    void emptyPrefixIsAllowed() {
        assertEquals("student", TableNames.prefixed("", TableNames.STUDENT));
        assertEquals("tenant_a_student", TableNames.prefixed("tenant_a_", TableNames.STUDENT));
    }

    @Test
    void invalidPrefixThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validatePrefix(null));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("a b"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("9_"));
    }

    @Test
    void everyTableIsListed() {
        assertEquals(9, TableNames.ALL.size());
    }
}
