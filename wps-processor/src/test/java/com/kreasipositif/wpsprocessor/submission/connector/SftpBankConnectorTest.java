package com.kreasipositif.wpsprocessor.submission.connector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SftpBankConnectorTest {

    @Test
    @DisplayName("Acknowledgement line STATUS,code,message keeps commas inside the message")
    void parseAck_fullLine() {
        StatusResponse status = SftpBankConnector.parseAck("REJECTED,E204,Account closed, employee EMP-0005");

        assertThat(status.status()).isEqualTo(BankStatus.REJECTED);
        assertThat(status.code()).isEqualTo("E204");
        assertThat(status.message()).isEqualTo("Account closed, employee EMP-0005");
    }

    @Test
    @DisplayName("A bare status word is enough")
    void parseAck_statusOnly() {
        StatusResponse status = SftpBankConnector.parseAck(" success ");

        assertThat(status.status()).isEqualTo(BankStatus.SUCCESS);
        assertThat(status.code()).isNull();
        assertThat(status.message()).isNull();
    }

    @Test
    @DisplayName("An empty acknowledgement is still processing")
    void parseAck_empty() {
        assertThat(SftpBankConnector.parseAck("").status()).isEqualTo(BankStatus.PROCESSING);
        assertThat(SftpBankConnector.parseAck(null).status()).isEqualTo(BankStatus.PROCESSING);
    }
}
