package com.mouse.apex.model;

public record CardsForecast(double expectedHomeYellow, double expectedAwayYellow, double expectedYellow,
                            double expectedRed, double expectedBookings, double dataQuality) {
}
