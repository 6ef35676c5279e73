package com.transitlog.backend;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.UnknownFieldSet;
import com.google.transit.realtime.GtfsRealtime.Alert;
import com.google.transit.realtime.GtfsRealtime.EntitySelector;
import com.google.transit.realtime.GtfsRealtime.FeedEntity;
import com.google.transit.realtime.GtfsRealtime.FeedHeader;
import com.google.transit.realtime.GtfsRealtime.FeedMessage;
import com.google.transit.realtime.GtfsRealtime.Position;
import com.google.transit.realtime.GtfsRealtime.TranslatedString;
import com.google.transit.realtime.GtfsRealtime.TripDescriptor;
import com.google.transit.realtime.GtfsRealtime.VehicleDescriptor;
import com.google.transit.realtime.GtfsRealtime.VehiclePosition;

import java.util.Arrays;

/**
 * Builders for GTFS-realtime messages used across tests.
 */
public final class GtfsFixtures {

    private GtfsFixtures() {
    }

    public static FeedMessage feed(FeedEntity... entities) {
        return FeedMessage.newBuilder()
                .setHeader(FeedHeader.newBuilder()
                        .setGtfsRealtimeVersion("2.0")
                        .setTimestamp(1705305600L))
                .addAllEntity(Arrays.asList(entities))
                .build();
    }

    public static VehiclePosition.Builder vehicle(String vehicleId, float longitude, float latitude) {
        return VehiclePosition.newBuilder()
                .setVehicle(VehicleDescriptor.newBuilder().setId(vehicleId))
                .setTrip(TripDescriptor.newBuilder()
                        .setTripId("13344510")
                        .setRouteId("6641")
                        .setDirectionId(1)
                        .setStartDate("20240115"))
                .setPosition(Position.newBuilder()
                        .setLongitude(longitude)
                        .setLatitude(latitude))
                .setCurrentStopSequence(12)
                .setTimestamp(1705305590L);
    }

    public static FeedEntity vehicleEntity(String id, VehiclePosition.Builder vehicle) {
        return FeedEntity.newBuilder().setId(id).setVehicle(vehicle).build();
    }

    public static TranslatedString text(String text, String language) {
        TranslatedString.Translation.Builder translation = TranslatedString.Translation.newBuilder().setText(text);
        if (language != null) {
            translation.setLanguage(language);
        }
        return TranslatedString.newBuilder().addTranslation(translation).build();
    }

    public static EntitySelector busRoute(String routeId) {
        return EntitySelector.newBuilder().setRouteType(3).setRouteId(routeId).build();
    }

    public static EntitySelector stop(String stopId) {
        return EntitySelector.newBuilder().setStopId(stopId).build();
    }

    public static EntitySelector trip(String tripId) {
        return EntitySelector.newBuilder().setTrip(TripDescriptor.newBuilder().setTripId(tripId)).build();
    }

    public static Alert.Builder alert(EntitySelector... informed) {
        return Alert.newBuilder()
                .addAllInformedEntity(Arrays.asList(informed))
                .setHeaderText(text("Detour", "en"))
                .setDescriptionText(text("Use stop 50001", "en"))
                .setCause(Alert.Cause.CONSTRUCTION)
                .setEffect(Alert.Effect.DETOUR);
    }

    /**
     * Sets severity_level, which older bindings only know as field 14. The alert is
     * re-parsed so it looks exactly like one read off the wire.
     */
    public static Alert.Builder withSeverity(Alert.Builder alert, long severity) {
        Alert tagged = alert.setUnknownFields(UnknownFieldSet.newBuilder()
                .addField(14, UnknownFieldSet.Field.newBuilder().addVarint(severity).build())
                .build())
                .build();
        try {
            return Alert.parseFrom(tagged.toByteArray()).toBuilder();
        } catch (InvalidProtocolBufferException e) {
            throw new IllegalStateException(e);
        }
    }

    public static FeedEntity alertEntity(String id, Alert.Builder alert) {
        return FeedEntity.newBuilder().setId(id).setAlert(alert).build();
    }
}
