package com.pitlane.timing.infrastructure.adapter.origin;

import com.pitlane.timing.infrastructure.adapter.origin.json.ErgastResponse;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;
import retrofit2.http.Query;

/**
 * Jolpica-Ergast F1 API, JSON flavour.
 */
public interface ErgastTimingApi {

    /**
     * Season calendar, one race per round.
     */
    @GET("ergast/f1/{year}.json")
    Call<ErgastResponse> fetchSchedule(@Path("year") int year, @Query("limit") int limit);

    @GET("ergast/f1/{year}/{round}/results.json")
    Call<ErgastResponse> fetchRaceResults(@Path("year") int year, @Path("round") int round,
                                          @Query("limit") int limit);

    @GET("ergast/f1/{year}/{round}/qualifying.json")
    Call<ErgastResponse> fetchQualifyingResults(@Path("year") int year, @Path("round") int round,
                                                @Query("limit") int limit);

    @GET("ergast/f1/{year}/{round}/sprint.json")
    Call<ErgastResponse> fetchSprintResults(@Path("year") int year, @Path("round") int round,
                                            @Query("limit") int limit);
}
