package io.fullerstack.csms.server.production;

import eu.chargetime.ocpp.model.core.AuthorizationStatus;
import eu.chargetime.ocpp.model.core.AvailabilityStatus;
import eu.chargetime.ocpp.model.core.AvailabilityType;
import eu.chargetime.ocpp.model.core.BootNotificationConfirmation;
import eu.chargetime.ocpp.model.core.BootNotificationRequest;
import eu.chargetime.ocpp.model.core.ChangeAvailabilityConfirmation;
import eu.chargetime.ocpp.model.core.ChangeAvailabilityRequest;
import eu.chargetime.ocpp.model.core.ChangeConfigurationConfirmation;
import eu.chargetime.ocpp.model.core.ChargePointErrorCode;
import eu.chargetime.ocpp.model.core.ChargePointStatus;
import eu.chargetime.ocpp.model.core.ClearCacheRequest;
import eu.chargetime.ocpp.model.core.ConfigurationStatus;
import eu.chargetime.ocpp.model.core.MeterValue;
import eu.chargetime.ocpp.model.core.MeterValuesRequest;
import eu.chargetime.ocpp.model.core.Reason;
import eu.chargetime.ocpp.model.core.RegistrationStatus;
import eu.chargetime.ocpp.model.core.RemoteStartStopStatus;
import eu.chargetime.ocpp.model.core.RemoteStartTransactionConfirmation;
import eu.chargetime.ocpp.model.core.RemoteStartTransactionRequest;
import eu.chargetime.ocpp.model.core.ResetRequest;
import eu.chargetime.ocpp.model.core.ResetType;
import eu.chargetime.ocpp.model.core.SampledValue;
import eu.chargetime.ocpp.model.core.StartTransactionConfirmation;
import eu.chargetime.ocpp.model.core.StartTransactionRequest;
import eu.chargetime.ocpp.model.core.StatusNotificationRequest;
import eu.chargetime.ocpp.model.core.StopTransactionRequest;
import io.fullerstack.csms.model.Availability;
import io.fullerstack.csms.model.ConnectorStatus;
import io.fullerstack.csms.model.Verdict;
import io.fullerstack.csms.server.InboundMessage;
import io.fullerstack.csms.server.InboundResponse;
import io.fullerstack.csms.server.OcppCommand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Translation between the ChargeTimeEU model classes and the central system's messages.
 * No socket is opened.
 */
@DisplayName("OcppJsonCentralSystem translation")
class OcppJsonCentralSystemTest {

    private static final ZonedDateTime T0 = ZonedDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Nested
    @DisplayName("Inbound requests")
    class Inbound {

        @Test
        @DisplayName("BootNotification keeps the identity fields")
        void testBootNotification() {
            BootNotificationRequest request = new BootNotificationRequest("ACME", "FastCharger");
            request.setChargePointSerialNumber("SN-1");
            request.setFirmwareVersion("1.2.3");

            InboundMessage.BootNotification boot = OcppJsonCentralSystem.toBootNotification("CP001", request);

            assertThat(boot).isEqualTo(new InboundMessage.BootNotification("CP001", "ACME", "FastCharger", "SN-1", "1.2.3"));
        }

        @Test
        @DisplayName("Unavailable status implies Inoperative")
        void testStatusUnavailable() {
            StatusNotificationRequest request =
                new StatusNotificationRequest(2, ChargePointErrorCode.NoError, ChargePointStatus.Unavailable);
            request.setTimestamp(T0);

            InboundMessage.StatusNotification status = OcppJsonCentralSystem.toStatusNotification("CP001", request);

            assertThat(status.connectorId()).isEqualTo(2);
            assertThat(status.status()).isEqualTo(ConnectorStatus.UNAVAILABLE);
            assertThat(status.availability()).isEqualTo(Availability.INOPERATIVE);
            assertThat(status.errorCode()).isEqualTo("NoError");
            assertThat(status.timestamp()).isEqualTo(T0.toInstant());
        }

        @Test
        @DisplayName("SuspendedEVSE maps and implies Operative")
        void testStatusSuspended() {
            StatusNotificationRequest request =
                new StatusNotificationRequest(1, ChargePointErrorCode.NoError, ChargePointStatus.SuspendedEVSE);

            InboundMessage.StatusNotification status = OcppJsonCentralSystem.toStatusNotification("CP001", request);

            assertThat(status.status()).isEqualTo(ConnectorStatus.SUSPENDED_EVSE);
            assertThat(status.availability()).isEqualTo(Availability.OPERATIVE);
            assertThat(status.timestamp()).isNull();
        }

        @Test
        @DisplayName("Start and stop carry meter readings and the stop reason")
        void testStartStop() {
            InboundMessage.StartTransaction start = OcppJsonCentralSystem.toStartTransaction("CP001",
                new StartTransactionRequest(1, "TAG001", 100, T0));
            StopTransactionRequest stopRequest = new StopTransactionRequest(150, T0.plusMinutes(30), 7);
            stopRequest.setReason(Reason.EVDisconnected);
            InboundMessage.StopTransaction stop = OcppJsonCentralSystem.toStopTransaction("CP001", stopRequest);

            assertThat(start).isEqualTo(new InboundMessage.StartTransaction("CP001", 1, "TAG001", 100, T0.toInstant()));
            assertThat(stop.transactionId()).isEqualTo(7);
            assertThat(stop.meterStop()).isEqualTo(150);
            assertThat(stop.reason()).isEqualTo("EVDisconnected");
            assertThat(stop.idTag()).isNull();
        }

        @Test
        @DisplayName("MeterValues are flattened with the meter value's timestamp")
        void testMeterValues() {
            SampledValue energy = new SampledValue("1234.5");
            energy.setMeasurand("Energy.Active.Import.Register");
            SampledValue power = new SampledValue("7400");
            power.setMeasurand("Power.Active.Import");
            MeterValue first = new MeterValue(T0, new SampledValue[] {energy, power});
            MeterValue second = new MeterValue(T0.plusMinutes(1), new SampledValue[] {new SampledValue("1240")});
            MeterValuesRequest request = new MeterValuesRequest(1, new MeterValue[] {first, second});
            request.setTransactionId(7);

            InboundMessage.MeterValues meterValues = OcppJsonCentralSystem.toMeterValues("CP001", request);

            assertThat(meterValues.transactionId()).isEqualTo(7);
            assertThat(meterValues.samples())
                .extracting(InboundMessage.SampledValue::value)
                .containsExactly(1234.5, 7400.0, 1240.0);
            assertThat(meterValues.samples())
                .extracting(InboundMessage.SampledValue::timestamp)
                .containsExactly(T0.toInstant(), T0.toInstant(), T0.plusMinutes(1).toInstant());
            assertThat(meterValues.samples().get(1).measurand()).isEqualTo("Power.Active.Import");
        }

        @Test
        @DisplayName("Non-numeric sampled value is skipped, the others are kept")
        void testMeterValuesSkipsNonNumeric() {
            SampledValue garbage = new SampledValue("n/a");
            SampledValue energy = new SampledValue(" 1500 ");
            MeterValue meterValue = new MeterValue(T0,
                new SampledValue[] {new SampledValue("1234"), garbage, new SampledValue("NaN"), energy});
            MeterValuesRequest request = new MeterValuesRequest(1, new MeterValue[] {meterValue});

            InboundMessage.MeterValues meterValues = OcppJsonCentralSystem.toMeterValues("CP001", request);

            assertThat(meterValues.samples())
                .extracting(InboundMessage.SampledValue::value)
                .containsExactly(1234.0, 1500.0);
        }
    }

    @Nested
    @DisplayName("Confirmations")
    class Confirmations {

        @Test
        @DisplayName("Boot confirmation carries status, time and interval")
        void testBootConfirmation() {
            Instant now = T0.toInstant();

            BootNotificationConfirmation accepted = OcppJsonCentralSystem.toConfirmation(
                new InboundResponse.Boot(InboundResponse.Registration.ACCEPTED, now, 300));
            BootNotificationConfirmation pending = OcppJsonCentralSystem.toConfirmation(
                new InboundResponse.Boot(InboundResponse.Registration.PENDING, now, 300));

            assertThat(accepted.getStatus()).isEqualTo(RegistrationStatus.Accepted);
            assertThat(accepted.getInterval()).isEqualTo(300);
            assertThat(accepted.getCurrentTime().toInstant()).isEqualTo(now);
            assertThat(pending.getStatus()).isEqualTo(RegistrationStatus.Pending);
        }

        @Test
        @DisplayName("Accepted start carries the transaction id")
        void testStartAccepted() {
            StartTransactionConfirmation confirmation =
                OcppJsonCentralSystem.toConfirmation(InboundResponse.StartTransaction.accepted(42));

            assertThat(confirmation.getTransactionId()).isEqualTo(42);
            assertThat(confirmation.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.Accepted);
        }

        @Test
        @DisplayName("Rejected starts carry id 0 and the mapped status")
        void testStartRejected() {
            StartTransactionConfirmation blocked = OcppJsonCentralSystem.toConfirmation(
                InboundResponse.StartTransaction.rejected(
                    InboundResponse.StartTransaction.Outcome.UNAUTHORIZED, Verdict.BLOCKED));
            StartTransactionConfirmation concurrent = OcppJsonCentralSystem.toConfirmation(
                InboundResponse.StartTransaction.rejected(
                    InboundResponse.StartTransaction.Outcome.CONCURRENT_TX, Verdict.ACCEPTED));
            StartTransactionConfirmation storage = OcppJsonCentralSystem.toConfirmation(
                InboundResponse.StartTransaction.rejected(
                    InboundResponse.StartTransaction.Outcome.STORAGE_FAILURE, Verdict.INVALID));

            assertThat(blocked.getTransactionId()).isZero();
            assertThat(blocked.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.Blocked);
            assertThat(concurrent.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.ConcurrentTx);
            assertThat(storage.getIdTagInfo().getStatus()).isEqualTo(AuthorizationStatus.Invalid);
        }

        @Test
        @DisplayName("Every verdict has an authorization status")
        void testVerdictMapping() {
            assertThat(OcppJsonCentralSystem.toAuthorizationStatus(Verdict.ACCEPTED)).isEqualTo(AuthorizationStatus.Accepted);
            assertThat(OcppJsonCentralSystem.toAuthorizationStatus(Verdict.BLOCKED)).isEqualTo(AuthorizationStatus.Blocked);
            assertThat(OcppJsonCentralSystem.toAuthorizationStatus(Verdict.EXPIRED)).isEqualTo(AuthorizationStatus.Expired);
            assertThat(OcppJsonCentralSystem.toAuthorizationStatus(Verdict.INVALID)).isEqualTo(AuthorizationStatus.Invalid);
        }
    }

    @Nested
    @DisplayName("Outbound commands")
    class Outbound {

        @Test
        @DisplayName("Commands become the matching library requests")
        void testToRequest() {
            RemoteStartTransactionRequest remoteStart = (RemoteStartTransactionRequest) OcppJsonCentralSystem.toRequest(
                new OcppCommand.RemoteStartTransaction("CP001", "c-1", 2, "TAG001"));
            ChangeAvailabilityRequest availability = (ChangeAvailabilityRequest) OcppJsonCentralSystem.toRequest(
                new OcppCommand.ChangeAvailability("CP001", "c-2", 0, Availability.INOPERATIVE));
            ResetRequest reset = (ResetRequest) OcppJsonCentralSystem.toRequest(
                new OcppCommand.Reset("CP001", "c-3", OcppCommand.Reset.Type.HARD));

            assertThat(remoteStart.getIdTag()).isEqualTo("TAG001");
            assertThat(remoteStart.getConnectorId()).isEqualTo(2);
            assertThat(availability.getConnectorId()).isZero();
            assertThat(availability.getType()).isEqualTo(AvailabilityType.Inoperative);
            assertThat(reset.getType()).isEqualTo(ResetType.Hard);
            assertThat(OcppJsonCentralSystem.toRequest(new OcppCommand.ClearCache("CP001", "c-4")))
                .isInstanceOf(ClearCacheRequest.class);
        }

        @Test
        @DisplayName("Confirmation status is read as the device sent it")
        void testStatusOf() {
            assertThat(OcppJsonCentralSystem.statusOf(
                new RemoteStartTransactionConfirmation(RemoteStartStopStatus.Rejected))).isEqualTo("Rejected");
            assertThat(OcppJsonCentralSystem.statusOf(
                new ChangeAvailabilityConfirmation(AvailabilityStatus.Scheduled))).isEqualTo("Scheduled");
            assertThat(OcppJsonCentralSystem.statusOf(
                new ChangeConfigurationConfirmation(ConfigurationStatus.RebootRequired))).isEqualTo("RebootRequired");
        }

        @Test
        @DisplayName("Charge point id is the last path segment")
        void testChargePointIdFrom() {
            assertThat(OcppJsonCentralSystem.chargePointIdFrom("/ocpp/CP001")).isEqualTo("CP001");
            assertThat(OcppJsonCentralSystem.chargePointIdFrom("/CP002/")).isEqualTo("CP002");
            assertThat(OcppJsonCentralSystem.chargePointIdFrom("CP003")).isEqualTo("CP003");
            assertThat(OcppJsonCentralSystem.chargePointIdFrom(null)).isNull();
        }
    }
}
